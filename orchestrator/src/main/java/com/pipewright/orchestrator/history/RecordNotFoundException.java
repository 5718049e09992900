package com.pipewright.orchestrator.history;

/** No persisted process, task log or resumable run matches the given key. */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String what, String key) {
        super(what + " not found: " + key);
    }
}
