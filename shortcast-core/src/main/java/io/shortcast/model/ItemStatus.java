package io.shortcast.model;

public enum ItemStatus {
  QUEUED(0),
  CONSUMED(1);

  private final int code;

  ItemStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ItemStatus fromCode(int code) {
    for (ItemStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown item status code: " + code);
  }
}
