package com.kotsin.optionsengine.trading;

import com.kotsin.optionsengine.model.TradeRecord;

/**
 * Called after a position has been closed, outside the trade-state lock.
 */
public interface TradeRecordListener {
    void onTradeClosed(TradeRecord record);
}
