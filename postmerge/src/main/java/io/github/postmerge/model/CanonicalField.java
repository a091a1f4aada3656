package io.github.postmerge.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Columns of the merged post file, in output order.
 */
public enum CanonicalField {
  SL("SL"),
  BARCODE("Barcode"),
  REF("REF"),
  SENDER_CITY("SenderCity"),
  SENDER_PINCODE("SenderPincode"),
  SENDER_NAME("SenderName"),
  SENDER_ADD1("SenderADD1"),
  SENDER_ADD2("SenderADD2"),
  SENDER_ADD3("SenderADD3"),
  ADDRE_CITY("AddreCity"),
  ADDRE_PINCODE("AddrePincode"),
  ADDRE_NAME("AddreName"),
  ADDRE_ADD1("AddreADD1"),
  ADDRE_ADD2("Addre_ADD2"),
  ADDRE_ADD3("Addre_ADD3"),
  ADDRE_EMAIL("ADDREMAIL"),
  ADDRE_MOBILE("ADDRMOBILE"),
  SENDER_MOBILE("SENDERMOBILE"),
  WEIGHT("Weight"),
  INS_VAL("InsVal"),
  PRPD_AMOUNT("PrPdAmount"),
  PRPD_TYPE("PrPdType"),
  FM_LICENSE_ID("FMLisenceId"),
  FM_SOM_NO("FMSomNo"),
  INPUT_FILE_NAME("Input File Name"),
  SHEET_NAME("Sheet Name");

  private final String header;

  CanonicalField(final String header) {
    this.header = header;
  }

  /**
   * Column header as written to the output file.
   *
   * @return the header
   */
  public String header() {
    return header;
  }

  /**
   * Field for an exact header name.
   *
   * @param header the header
   * @return the field, if any
   */
  public static Optional<CanonicalField> fromHeader(final String header) {
    return Arrays.stream(values()).filter(f -> f.header.equals(header)).findFirst();
  }

  /**
   * All output headers in order.
   *
   * @return the headers
   */
  public static List<String> headers() {
    return Arrays.stream(values()).map(CanonicalField::header).collect(Collectors.toList());
  }
}
