package com.example.medialibrary.service;

import com.example.medialibrary.model.QueueItem;

/**
 * Observer of queue items. Callbacks run on the thread that changed the item, usually an ingest worker,
 * and should return quickly. Events of one item arrive in the order its status changed.
 */
public interface AcquisitionListener {

    default void onProgress(QueueItem item) {
    }

    default void onComplete(QueueItem item) {
    }

    default void onError(QueueItem item) {
    }

    default void onCancelled(QueueItem item) {
    }
}
