package com.connretry.model.ctx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单次外层调用内的失败记录, 只追加
 */
public class ExceptionStack {

    private final List<Throwable> entries = new ArrayList<>();

    public void push(Throwable error) {
        entries.add(Objects.requireNonNull(error, "error"));
    }

    /** 最近一次失败, 没有则返回 null */
    public Throwable last() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** 只读快照, 按发生顺序 */
    public List<Throwable> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public String toString() {
        return "ExceptionStack[size=" + entries.size() + ", last=" + last() + "]";
    }
}
