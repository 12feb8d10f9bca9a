package com.articlegate.core.http;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * read 한 번이 idle 시간을 넘기면 스트림을 닫고 읽는 스레드를 interrupt 해서 막힌 read 를 깨운다 (slow-drip 피어 대응).
 * HttpClient 의 요청 timeout 은 응답 헤더까지만 적용되므로 본문 구간은 여기서 막는다.
 * HttpClient 본문 스트림은 close 만으로는 대기 중인 read 가 풀리지 않을 수 있어 interrupt 를 같이 쓴다.
 * 우리가 건 interrupt 플래그는 read 를 빠져나오기 전에 지운다.
 */
final class IdleTimeoutInputStream extends FilterInputStream {

    private static final Logger LOG = Logger.getLogger(IdleTimeoutInputStream.class.getName());
    private static final ScheduledThreadPoolExecutor WATCHDOG = newWatchdog();

    private final long idleMs;
    private final Object lock = new Object();
    private Thread reader;              // lock 보호, read 중일 때만 non-null
    private long generation;            // lock 보호, arm 마다 증가
    private volatile boolean timedOut;

    IdleTimeoutInputStream(InputStream in, Duration idle) {
        super(in);
        this.idleMs = Math.max(1, idle.toMillis());
    }

    @Override
    public int read() throws IOException {
        checkTimedOut();
        ScheduledFuture<?> guard = arm();
        try {
            int r = super.read();
            checkTimedOut();
            return r;
        } catch (IOException e) {
            checkTimedOut();
            throw e;
        } finally {
            disarm(guard);
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        checkTimedOut();
        ScheduledFuture<?> guard = arm();
        try {
            int n = super.read(b, off, len);
            checkTimedOut();
            return n;
        } catch (IOException e) {
            checkTimedOut();
            throw e;
        } finally {
            disarm(guard);
        }
    }

    private ScheduledFuture<?> arm() {
        long token;
        synchronized (lock) {
            reader = Thread.currentThread();
            token = ++generation;
        }
        return WATCHDOG.schedule(() -> expire(token), idleMs, TimeUnit.MILLISECONDS);
    }

    private void disarm(ScheduledFuture<?> guard) {
        guard.cancel(false);
        synchronized (lock) {
            reader = null;
        }
        if (timedOut) {
            Thread.interrupted();
        }
    }

    private void checkTimedOut() throws SocketTimeoutException {
        if (timedOut) throw new SocketTimeoutException("read timed out after " + idleMs + "ms");
    }

    /** token 이 현재 read 의 것이 아니면 (이미 끝난 read 의 늦은 워치독) 아무것도 하지 않는다 */
    void expire(long token) {
        Thread t;
        synchronized (lock) {
            if (reader == null || token != generation) return;
            timedOut = true;
            t = reader;
            t.interrupt();
        }
        try {
            in.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "close on idle timeout failed: " + e.getMessage(), e);
        }
    }

    long generation() {
        synchronized (lock) {
            return generation;
        }
    }

    boolean isTimedOut() {
        return timedOut;
    }

    private static ScheduledThreadPoolExecutor newWatchdog() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "ag-read-watchdog");
            t.setDaemon(true);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        return ex;
    }
}
