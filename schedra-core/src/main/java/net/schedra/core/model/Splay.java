package net.schedra.core.model;

import java.util.Random;

/** 발화 시각에 더할 무작위 지연 구간(초, 양끝 포함) */
public record Splay(int startSeconds, int endSeconds) {
    public Splay {
        if (startSeconds < 0 || endSeconds < startSeconds) {
            throw new IllegalArgumentException("invalid splay [" + startSeconds + ", " + endSeconds + "]");
        }
        // 구간 크기가 int 를 넘으면 Random.nextInt 로 뽑을 수 없다
        if ((long) endSeconds - startSeconds + 1 > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("splay too large [" + startSeconds + ", " + endSeconds + "]");
        }
    }

    public static Splay upTo(int seconds) { return new Splay(0, seconds); }

    /** [start, end] 에서 균등하게 하나 */
    public int pick(Random random) {
        return startSeconds + random.nextInt(endSeconds - startSeconds + 1);
    }
}
