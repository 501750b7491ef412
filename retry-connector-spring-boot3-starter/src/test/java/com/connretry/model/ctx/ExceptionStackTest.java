package com.connretry.model.ctx;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionStackTest {

    @Test
    void lastIsNullWhenEmpty() {
        ExceptionStack stack = new ExceptionStack();

        assertThat(stack.last()).isNull();
        assertThat(stack.isEmpty()).isTrue();
        assertThat(stack.snapshot()).isEmpty();
    }

    @Test
    void keepsInsertionOrderAndReportsMostRecent() {
        ExceptionStack stack = new ExceptionStack();
        SQLException first = new SQLException("first");
        RuntimeException second = new IllegalStateException("second");

        stack.push(first);
        stack.push(second);

        assertThat(stack.size()).isEqualTo(2);
        assertThat(stack.last()).isSameAs(second);
        assertThat(stack.snapshot()).containsExactly(first, second);
    }

    @Test
    void snapshotIsDetachedAndReadOnly() {
        ExceptionStack stack = new ExceptionStack();
        stack.push(new SQLException("a"));

        List<Throwable> snapshot = stack.snapshot();
        stack.push(new SQLException("b"));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(new SQLException("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void clearEmptiesTheStack() {
        ExceptionStack stack = new ExceptionStack();
        stack.push(new SQLException("a"));

        stack.clear();

        assertThat(stack.size()).isZero();
        assertThat(stack.last()).isNull();
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> new ExceptionStack().push(null))
                .isInstanceOf(NullPointerException.class);
    }
}
