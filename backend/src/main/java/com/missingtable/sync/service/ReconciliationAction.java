package com.missingtable.sync.service;

public enum ReconciliationAction {
    CREATE, UPDATE, SKIP, CONFLICT
}
