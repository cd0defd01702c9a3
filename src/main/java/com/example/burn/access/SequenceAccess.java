package com.example.burn.access;

/**
 * Hands out strictly increasing ids for ledger entries.
 */
public interface SequenceAccess {

    long next(String sequenceName);
}
