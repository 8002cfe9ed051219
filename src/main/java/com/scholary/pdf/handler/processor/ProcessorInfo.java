package com.scholary.pdf.handler.processor;

public record ProcessorInfo(String name, String description, boolean isDefault) {}
