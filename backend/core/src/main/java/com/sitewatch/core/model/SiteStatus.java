package com.sitewatch.core.model;

public enum SiteStatus {
    PENDING,
    OK,
    ERROR
}
