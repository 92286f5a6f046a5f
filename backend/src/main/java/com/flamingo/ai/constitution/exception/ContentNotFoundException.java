package com.flamingo.ai.constitution.exception;

/** Exception thrown when a chapter or article does not exist in the document. */
public class ContentNotFoundException extends ConstitutionException {

  private final String contentType;
  private final String reference;

  public ContentNotFoundException(String contentType, String reference) {
    super(
        ErrorKind.NOT_FOUND,
        contentType + " not found: " + reference,
        capitalize(contentType) + " " + reference + " does not exist");
    this.contentType = contentType;
    this.reference = reference;
  }

  public static ContentNotFoundException chapter(int chapterNumber) {
    return new ContentNotFoundException("chapter", String.valueOf(chapterNumber));
  }

  public static ContentNotFoundException article(int chapterNumber, int articleNumber) {
    return new ContentNotFoundException("article", chapterNumber + "." + articleNumber);
  }

  public String getContentType() {
    return contentType;
  }

  public String getReference() {
    return reference;
  }

  private static String capitalize(String value) {
    return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
