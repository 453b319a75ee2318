package com.autonomous.content.controller;

public record StoreApiKeyRequest(String service, String apiKey) {}
