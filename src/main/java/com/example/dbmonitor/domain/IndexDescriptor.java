package com.example.dbmonitor.domain;

public record IndexDescriptor(String name, String definition) {}
