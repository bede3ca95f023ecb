package com.cmflineage.store;

@FunctionalInterface
public interface TransactionWork<T> {
    T apply(Transaction tx);
}
