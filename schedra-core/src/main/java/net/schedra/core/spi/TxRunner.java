package net.schedra.core.spi;

import java.util.concurrent.Callable;

/** 영속 어댑터가 쓰는 트랜잭션 경계 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
}
