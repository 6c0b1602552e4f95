/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.twinjs.js;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Single-threaded scheduler: a microtask queue drained to exhaustion before each timer
 * callback, and timers released in (due time, registration order) on a virtual clock,
 * so no host thread ever waits.
 */
public class EventLoop {

    static final Logger logger = LoggerFactory.getLogger(EventLoop.class);

    private static final class Timer implements Comparable<Timer> {

        final int id;
        final JsFunction callback;
        final Object[] args;
        final long interval;
        final boolean repeat;
        long due;
        long seq;
        boolean cancelled;

        Timer(int id, JsFunction callback, Object[] args, long interval, boolean repeat) {
            this.id = id;
            this.callback = callback;
            this.args = args;
            this.interval = interval;
            this.repeat = repeat;
        }

        @Override
        public int compareTo(Timer o) {
            int c = Long.compare(due, o.due);
            return c != 0 ? c : Long.compare(seq, o.seq);
        }

    }

    private final Realm realm;
    private final Deque<Runnable> microtasks = new ArrayDeque<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>();
    private final Map<Integer, Timer> activeTimers = new HashMap<>();
    private long now;
    private long seq;
    private int nextTimerId = 1;
    private long taskCount;
    private boolean stopped;

    EventLoop(Realm realm) {
        this.realm = realm;
    }

    public void queueMicrotask(Runnable task) {
        microtasks.add(task);
    }

    public int setTimer(JsFunction callback, long delay, Object[] args, boolean repeat) {
        Timer timer = new Timer(nextTimerId++, callback, args, delay, repeat);
        schedule(timer, delay);
        activeTimers.put(timer.id, timer);
        return timer.id;
    }

    private void schedule(Timer timer, long delay) {
        timer.due = now + delay;
        timer.seq = seq++;
        timers.add(timer);
    }

    public void clearTimer(int id) {
        Timer timer = activeTimers.remove(id);
        if (timer != null) {
            timer.cancelled = true;
        }
    }

    /**
     * Virtual time in milliseconds, advanced as timers are released.
     */
    public long getTime() {
        return now;
    }

    public boolean hasPendingWork() {
        return !microtasks.isEmpty() || !activeTimers.isEmpty();
    }

    /**
     * Runs microtasks until the queue is empty, then reports promises left rejected without a handler.
     */
    public void runMicrotasks() {
        while (!microtasks.isEmpty() && !stopped) {
            Runnable task = microtasks.poll();
            if (!countTask()) {
                return;
            }
            try {
                task.run();
            } catch (JsException e) {
                uncaught(e);
            }
        }
        realm.flushRejections();
    }

    /**
     * Drives the loop until both queues are empty or the task budget is spent.
     */
    public void run() {
        while (!stopped) {
            runMicrotasks();
            if (stopped) {
                break;
            }
            Timer timer = timers.poll();
            if (timer == null) {
                break;
            }
            if (timer.cancelled) {
                continue;
            }
            now = Math.max(now, timer.due);
            if (!countTask()) {
                break;
            }
            if (timer.repeat) {
                schedule(timer, Math.max(1, timer.interval));
            } else {
                activeTimers.remove(timer.id);
            }
            if (logger.isTraceEnabled()) {
                logger.trace("timer {} at {}ms", timer.id, now);
            }
            runCallback(timer.callback, timer.args);
        }
    }

    /**
     * Calls a scheduled JS callback, reporting an uncaught throw instead of propagating it.
     */
    void runCallback(JsFunction callback, Object[] args) {
        try {
            callback.call(realm, Terms.UNDEFINED, args);
        } catch (JsException e) {
            uncaught(e);
        }
    }

    private void uncaught(JsException e) {
        realm.report(new Diagnostic(Diagnostic.Kind.UNCAUGHT_ERROR, e.getMessage(), e.toReport()));
    }

    private boolean countTask() {
        if (++taskCount > realm.config.getMaxTasks()) {
            stopped = true;
            microtasks.clear();
            timers.clear();
            activeTimers.clear();
            realm.report(new Diagnostic(Diagnostic.Kind.TASK_LIMIT, "event loop task budget exceeded: " + realm.config.getMaxTasks(), null));
            return false;
        }
        return true;
    }

}
