package io.github.postmerge.model;

import org.immutables.value.Value;

/**
 * Sender details for the input files whose name matches {@link #fileNameKey()}.
 */
@Value.Immutable
public interface SenderProfile {

  /**
   * Text that contains the file name key of matching input files.
   */
  @Value.Default
  default String fileNameKey() {
    return "";
  }

  @Value.Default
  default String senderCity() {
    return "";
  }

  @Value.Default
  default String senderPincode() {
    return "";
  }

  @Value.Default
  default String senderName() {
    return "";
  }

  @Value.Default
  default String senderAdd1() {
    return "";
  }

  @Value.Default
  default String senderAdd2() {
    return "";
  }

  @Value.Default
  default String senderAdd3() {
    return "";
  }
}
