package com.autonomous.content.service;

public record OrganizationCreatedEvent(String organizationId) {}
