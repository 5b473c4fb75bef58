package org.dotnes.compiler.translate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class StackValueTest {

    @Test
    @Tag("unit")
    void constantsWrapToSixteenBits() {
        assertThat(new StackValue.Constant(0x12345).value()).isEqualTo(0x2345);
        assertThat(new StackValue.Constant(-1).value()).isEqualTo(0xFFFF);
        assertThat(new StackValue.Constant(0x10005)).isEqualTo(new StackValue.Constant(5));
    }

    @Test
    @Tag("unit")
    void constantWidthFollowsTheWrappedValue() {
        assertThat(new StackValue.Constant(0xFF).width()).isEqualTo(ValueWidth.BYTE);
        assertThat(new StackValue.Constant(0x100).width()).isEqualTo(ValueWidth.WORD);
        assertThat(new StackValue.Constant(0x10020).width()).isEqualTo(ValueWidth.BYTE);
        assertThat(new StackValue.Constant(7).isLazy()).isTrue();
    }
}
