package com.eainde.truckticket;

import com.eainde.truckticket.ocr.OcrEngine;
import com.eainde.truckticket.ocr.OcrException;
import com.eainde.truckticket.ocr.OcrPage;

import java.nio.file.Path;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted OCR keyed by file name: returns the registered pages, after first throwing any
 * queued failures for that file.
 */
public class FakeOcrEngine implements OcrEngine {

    private final Map<String, List<OcrPage>> pages = new ConcurrentHashMap<>();
    private final Map<String, Deque<Exception>> failures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, Hook> hooks = new ConcurrentHashMap<>();

    /** Runs inside {@link #recognize}, before the registered pages are returned. */
    @FunctionalInterface
    public interface Hook {
        void run() throws Exception;
    }

    public FakeOcrEngine register(Path file, OcrPage... filePages) {
        pages.put(file.getFileName().toString(), List.of(filePages));
        return this;
    }

    /** Queues failures thrown by the next calls for {@code file}, in order. */
    public FakeOcrEngine failFirst(Path file, Exception... errors) {
        Deque<Exception> queue = failures.computeIfAbsent(file.getFileName().toString(),
                k -> new ConcurrentLinkedDeque<>());
        for (Exception e : errors) {
            queue.add(e);
        }
        return this;
    }

    /** Runs {@code hook} during every recognition of {@code file}. */
    public FakeOcrEngine during(Path file, Hook hook) {
        hooks.put(file.getFileName().toString(), hook);
        return this;
    }

    public int calls(Path file) {
        AtomicInteger n = calls.get(file.getFileName().toString());
        return n == null ? 0 : n.get();
    }

    @Override
    public List<OcrPage> recognize(Path file) throws OcrException {
        String name = file.getFileName().toString();
        calls.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
        Deque<Exception> queue = failures.get(name);
        Exception next = queue == null ? null : queue.poll();
        if (next instanceof OcrException) {
            throw (OcrException) next;
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        if (next != null) {
            throw new OcrException("scripted failure", next);
        }
        Hook hook = hooks.get(name);
        if (hook != null) {
            try {
                hook.run();
            } catch (Exception e) {
                throw new OcrException("hook failed for " + name, e);
            }
        }
        List<OcrPage> result = pages.get(name);
        if (result == null) {
            throw new OcrException("No pages registered for " + name);
        }
        return result;
    }
}
