package com.verilang.frontend.ast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AstList 测试")
class AstListTest {

    private AstList<String> list;

    @BeforeEach
    void setUp() {
        list = new AstList<>();
    }

    // ============ 插入 ============

    @Nested
    @DisplayName("append / prepend")
    class Insertion {

        @Test
        @DisplayName("新建序列为空")
        void testNewListIsEmpty() {
            assertThat(list.isEmpty()).isTrue();
            assertThat(list.size()).isZero();
        }

        @Test
        @DisplayName("append 追加到尾部")
        void testAppend() {
            list.append("a");
            list.append("b");
            list.append("c");

            assertThat(list.asList()).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("prepend 插入到头部")
        void testPrepend() {
            list.append("a");
            list.prepend("b");
            list.prepend("c");

            assertThat(list.asList()).containsExactly("c", "b", "a");
        }

        @Test
        @DisplayName("不去重")
        void testKeepsDuplicates() {
            list.append("x");
            list.append("x");

            assertThat(list.size()).isEqualTo(2);
        }
    }

    // ============ 连接 ============

    @Nested
    @DisplayName("concat")
    class Concat {

        @Test
        @DisplayName("source 追加到尾部并被清空")
        void testConcatConsumesSource() {
            list.append("a");
            AstList<String> source = new AstList<>();
            source.append("b");
            source.append("c");

            list.concat(source);

            assertThat(list.asList()).containsExactly("a", "b", "c");
            assertThat(source.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("连接空序列不改变内容")
        void testConcatEmpty() {
            list.append("a");

            list.concat(new AstList<>());

            assertThat(list.asList()).containsExactly("a");
        }

        @Test
        @DisplayName("不能连接自身")
        void testConcatSelf() {
            list.append("a");

            assertThatThrownBy(() -> list.concat(list))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ============ 访问 ============

    @Nested
    @DisplayName("get")
    class Get {

        @Test
        @DisplayName("按下标取元素")
        void testGet() {
            list.append("a");
            list.append("b");

            assertThat(list.get(0)).isEqualTo("a");
            assertThat(list.get(1)).isEqualTo("b");
        }

        @Test
        @DisplayName("越界返回 null")
        void testGetOutOfRange() {
            list.append("a");

            assertThat(list.get(-1)).isNull();
            assertThat(list.get(1)).isNull();
        }

        @Test
        @DisplayName("只读视图不可修改")
        void testAsListIsReadOnly() {
            list.append("a");

            assertThatThrownBy(() -> list.asList().add("b"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("迭代保持插入顺序")
        void testIteration() {
            list.append("a");
            list.prepend("b");
            StringBuilder sb = new StringBuilder();
            for (String s : list) {
                sb.append(s);
            }

            assertThat(sb.toString()).isEqualTo("ba");
        }
    }
}
