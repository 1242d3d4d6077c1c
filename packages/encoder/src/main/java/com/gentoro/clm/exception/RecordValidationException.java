package com.gentoro.clm.exception;

/** A single structured-data record failed validation; the rest of the batch is unaffected. */
public class RecordValidationException extends ClmException {
  private final int recordIndex;
  private final String field;

  public RecordValidationException(int recordIndex, String field, String message) {
    super(ClmErrorCode.RECORD_VALIDATION_ERROR, message);
    this.recordIndex = recordIndex;
    this.field = field;
    withContext("index", recordIndex);
    withContext("field", field);
  }

  public int getRecordIndex() {
    return recordIndex;
  }

  public String getField() {
    return field;
  }
}
