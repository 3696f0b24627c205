package com.kotsin.optionsengine.market;

import com.kotsin.optionsengine.model.IndexName;

/** Notified after a tick for {@code index} has been appended. */
public interface PriceUpdateListener {
    void onPriceUpdate(IndexName index);
}
