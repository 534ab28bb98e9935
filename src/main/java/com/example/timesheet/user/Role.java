package com.example.timesheet.user;

public enum Role {
    ADMIN,
    EMPLOYEE
}
