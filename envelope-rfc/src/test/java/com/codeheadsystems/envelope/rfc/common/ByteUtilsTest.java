package com.codeheadsystems.envelope.rfc.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.envelope.exceptions.EnvelopeException;
import com.codeheadsystems.envelope.exceptions.ErrorKind;
import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Constructor ──────────────────────────────────────────────────────────

  @Test
  void privateConstructorIsInaccessible() throws Exception {
    Constructor<ByteUtils> ctor = ByteUtils.class.getDeclaredConstructor();
    ctor.setAccessible(true);
    ctor.newInstance();
  }

  // ─── I2OSP ────────────────────────────────────────────────────────────────

  @Test
  void i2osp_fourByteBigEndian() {
    assertThat(ByteUtils.I2OSP(256, 4)).isEqualTo(new byte[]{0x00, 0x00, 0x01, 0x00});
  }

  @Test
  void i2osp_singleByteMaximum() {
    assertThat(ByteUtils.I2OSP(255, 1)).isEqualTo(new byte[]{(byte) 0xFF});
  }

  @Test
  void i2osp_valueTooLargeForLengthThrows() {
    assertInvalid(() -> ByteUtils.I2OSP(256, 1));
    assertInvalid(() -> ByteUtils.I2OSP(65536, 2));
  }

  @Test
  void i2osp_negativeValueOrBadWidthThrows() {
    assertInvalid(() -> ByteUtils.I2OSP(-1, 4));
    assertInvalid(() -> ByteUtils.I2OSP(1, 0));
    assertInvalid(() -> ByteUtils.I2OSP(1, 5));
  }

  // ─── lengthPrefixed ───────────────────────────────────────────────────────

  @Test
  void lengthPrefixed_emptyIsFourZeroBytes() {
    assertThat(ByteUtils.lengthPrefixed(new byte[0])).isEqualTo(new byte[4]);
  }

  @Test
  void lengthPrefixed_prependsBigEndianLength() {
    assertThat(ByteUtils.lengthPrefixed(new byte[]{'B', 'o', 'b'}))
        .isEqualTo(new byte[]{0, 0, 0, 3, 'B', 'o', 'b'});
  }

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void concat_preservesOrder() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3}))
        .isEqualTo(new byte[]{1, 2, 3});
  }

  // ─── constantTimeEquals ───────────────────────────────────────────────────

  @Test
  void constantTimeEquals_sameBytes() {
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 2})).isTrue();
  }

  @Test
  void constantTimeEquals_differentBytes() {
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1, 2}, new byte[]{1, 3})).isFalse();
  }

  @Test
  void constantTimeEquals_differentLengths() {
    assertThat(ByteUtils.constantTimeEquals(new byte[]{1}, new byte[]{1, 0})).isFalse();
  }

  // ─── wipe ─────────────────────────────────────────────────────────────────

  @Test
  void wipe_zeroesEveryArrayAndSkipsNull() {
    byte[] a = {1, 2, 3};
    byte[] b = {4};
    ByteUtils.wipe(a, null, b);
    assertThat(a).containsOnly(0);
    assertThat(b).containsOnly(0);
  }

  private static void assertInvalid(Runnable call) {
    assertThatThrownBy(call::run)
        .isInstanceOf(EnvelopeException.class)
        .satisfies(e -> assertThat(((EnvelopeException) e).kind()).isEqualTo(ErrorKind.INVALID_PARAMETER));
  }
}
