package com.bulletin.lifecycle.chain;

/**
 * Listener notified after a record has been stored, either through a local
 * append or through integration of a record authored on another replica.
 *
 * @param <T> payload type
 */
public interface ChainListener<T> {

    void onRecordStored(ChainRecord<T> record);
}
