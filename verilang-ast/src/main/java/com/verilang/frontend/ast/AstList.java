package com.verilang.frontend.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 有序序列
 *
 * <p>表示文法中的重复结构（参数列表、端口列表、case 分支、拼接项等）。
 * 保持插入顺序，从不去重或重排。</p>
 */
public final class AstList<T> implements Iterable<T> {
    private final List<T> items;

    public AstList() {
        this.items = new ArrayList<>();
    }

    /** 追加到尾部 */
    public void append(T item) {
        items.add(item);
    }

    /** 插入到头部 */
    public void prepend(T item) {
        items.add(0, item);
    }

    /**
     * 将 source 的全部元素按顺序追加到当前序列尾部，随后清空 source。
     */
    public void concat(AstList<? extends T> source) {
        if (source == this) {
            throw new IllegalArgumentException("Cannot concatenate a list onto itself");
        }
        items.addAll(source.items);
        source.items.clear();
    }

    /**
     * 按下标取元素，越界时返回 null
     */
    public T get(int index) {
        if (index < 0 || index >= items.size()) {
            return null;
        }
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** 只读视图 */
    public List<T> asList() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
