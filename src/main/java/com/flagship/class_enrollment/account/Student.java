package com.flagship.class_enrollment.account;

import lombok.Value;

import java.util.UUID;

@Value
public class Student {
    UUID id;
    String name;
    UUID parentId;
}
