package com.ospicorp.abundanceindex.common;

/**
 * Raised when the caller hands the pipeline data or options it cannot work with: missing
 * columns, tables for different species, an unsupported model family. Always fatal for the run.
 */
public class InputContractException extends RuntimeException {
  public static final int MISSING_COLUMNS = 2001;
  public static final int INVALID_VALUE = 2002;
  public static final int SPECIES_MISMATCH = 2003;
  public static final int UNSUPPORTED_FAMILY = 2004;
  public static final int INVALID_OPTION = 2005;

  private static final String ERROR_DOCS_BASE = "https://docs.abundance-index.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InputContractException(String message, int errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public static InputContractException of(String message, int errorCode) {
    return new InputContractException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
