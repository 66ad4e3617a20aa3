package io.skuldata.actionlog.codec;

/** 構造変換で JSON 安全な値にできなかったことを示す。codec の外へは漏れない。 */
public class MetadataConversionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MetadataConversionException(String message) {
    super(message);
  }

  public MetadataConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
