package com.autonomous.content.service;

import java.time.Duration;

/**
 * One fixed-window ceiling: at most {@code maxRequests} per {@code window}.
 */
public record WindowLimit(int maxRequests, Duration window) {}
