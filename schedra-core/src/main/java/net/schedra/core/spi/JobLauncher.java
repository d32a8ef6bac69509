package net.schedra.core.spi;

/**
 * 잡 본문을 스케줄러 틱 밖에서 실행한다.
 * {@code body} 는 완료 콜백(permit 반납, 상태 갱신)을 이미 포함하고 있으므로
 * 런처는 실행만 책임진다. 큐 포화 등으로 받지 못하면 RuntimeException 을 던진다.
 */
public interface JobLauncher extends AutoCloseable {
    void launch(String jobName, Runnable body);

    boolean isRunning(String jobName);

    @Override
    void close();
}
