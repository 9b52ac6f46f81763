package com.apex.guardian.service.marketdata;

public record LeverageBracket(String symbol, int maxLeverage) {}
