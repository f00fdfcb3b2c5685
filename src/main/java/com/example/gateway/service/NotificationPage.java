package com.example.gateway.service;

import com.example.gateway.api.PaginationMeta;
import com.example.gateway.model.NotificationStatusRecord;

import java.util.List;

public record NotificationPage(
        List<NotificationStatusRecord> items,
        PaginationMeta meta
) {}
