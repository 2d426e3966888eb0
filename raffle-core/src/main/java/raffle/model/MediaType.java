package raffle.model;

/**
 * Kind of file attached to a broadcast.
 */
public enum MediaType {
  PHOTO("photo"),
  VIDEO("video"),
  DOCUMENT("document"),
  AUDIO("audio");

  private final String code;

  MediaType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static MediaType fromCode(String code) {
    for (MediaType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown media type: " + code);
  }
}
