package net.schedra.core.spi;

/** 상태 저장소 입출력 실패 */
public class PersistenceException extends Exception {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
