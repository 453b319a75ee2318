package com.autonomous.content.controller;

import com.autonomous.content.model.MemberRole;

public record AddMemberRequest(String userId, MemberRole role) {}
