package com.regimeplatform.common.config;

/**
 * How a truth submission is matched to a pending prediction.
 * <ul>
 *   <li>{@link #KEYED}: by {@code prediction_id} or {@code (series_id, target_timestamp)}</li>
 *   <li>{@link #FIFO}: legacy, additionally accepts {@code series_id} alone and resolves the
 *       oldest pending prediction of that series</li>
 * </ul>
 */
public enum TruthMatching {
    KEYED,
    FIFO
}
