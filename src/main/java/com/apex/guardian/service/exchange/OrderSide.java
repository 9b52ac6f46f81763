package com.apex.guardian.service.exchange;

import com.apex.guardian.model.Direction;

public enum OrderSide {
    BUY,
    SELL;

    public static OrderSide opening(Direction direction) {
        return direction.isLong() ? BUY : SELL;
    }

    public static OrderSide closing(Direction direction) {
        return direction.isLong() ? SELL : BUY;
    }
}
