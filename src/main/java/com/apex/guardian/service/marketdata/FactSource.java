package com.apex.guardian.service.marketdata;

public enum FactSource {
    LIVE,
    CACHE
}
