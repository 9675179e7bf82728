package com.example.spimex.topology;

public enum Severity {
    ERROR,
    WARNING
}
