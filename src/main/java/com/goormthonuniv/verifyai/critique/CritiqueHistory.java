package com.goormthonuniv.verifyai.critique;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 레드팀 실행 이력(프로세스 수명). 최근 N건만 유지하는 링 버퍼.
 * 동시 분석이 있어도 "최근 이력 읽기 + 추가"는 하나의 락 안에서 원자적으로 처리한다.
 */
@Component
public class CritiqueHistory {

    public record Entry(
            Instant timestamp,
            String fileHash,          // SHA-256 앞 16자
            int challengeCount,
            int blindSpotCount,
            double adjustment,
            boolean verdictChallenged
    ) {}

    /** recordRun 결과: 이번 실행을 넣기 전 최근 창의 평균 챌린지 수 + 넣은 뒤 크기 */
    public record Trend(OptionalDouble recentAverageChallenges, int size) {}

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public CritiqueHistory(@Value("${verifyai.critique.history-capacity:200}") int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("history capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    /**
     * 직전 {@code window}건(그만큼 쌓였을 때만)의 평균 챌린지 수를 읽고, 이번 실행을 추가한다.
     * 용량을 넘으면 가장 오래된 항목부터 버린다.
     */
    public Trend recordRun(Entry entry, int window) {
        lock.lock();
        try {
            OptionalDouble avg = OptionalDouble.empty();
            if (window > 0 && entries.size() >= window) {
                Iterator<Entry> it = entries.descendingIterator();
                double sum = 0;
                for (int i = 0; i < window; i++) sum += it.next().challengeCount();
                avg = OptionalDouble.of(sum / window);
            }
            entries.addLast(entry);
            while (entries.size() > capacity) entries.removeFirst();
            return new Trend(avg, entries.size());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<Entry> snapshot() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(entries));
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
