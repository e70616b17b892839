package com.automate.CodeAudit.entity;

public enum UserRole {
    ADMIN,
    USER
}
