package com.jz.guard.guard.lock;

/** 持有期间同一 identity 的审核流程串行执行；用 try-with-resources 释放 */
public interface IdentityLock extends AutoCloseable {

    String identity();

    @Override
    void close();
}
