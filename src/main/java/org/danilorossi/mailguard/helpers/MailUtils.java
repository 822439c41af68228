package org.danilorossi.mailguard.helpers;

import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeUtility;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import lombok.Cleanup;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.java.Log;
import lombok.val;
import org.jsoup.Jsoup;

@Log
@UtilityClass
public final class MailUtils {

  static {
    LogConfigurator.configLog(log);
  }

  /** Hard cap to avoid unbounded memory when parsing pathological emails. */
  public static final int MAX_OUTPUT_CHARS = 200_000;

  public static String cleanText(final String text) {
    if (text == null) return "";
    // Collapse NBSP and excessive whitespace/newlines
    return text.replace('\u00A0', ' ')
        .replaceAll("\\R+", "\n")
        .replaceAll("[\\t\\x0B\\f ]{2,}", " ")
        .trim();
  }

  public static Charset detectCharset(@NonNull final Part part) {
    try {
      val ct = part.getContentType();
      if (ct != null) {
        val cs = new ContentType(ct).getParameter("charset");
        if (cs != null) {
          try {
            // Normalize common weird labels (e.g., utf8, cp-1252, etc.)
            String norm = cs.trim().toLowerCase(Locale.ROOT).replace("_", "-");
            if ("utf8".equals(norm)) norm = "utf-8";
            return Charset.forName(norm);
          } catch (IllegalCharsetNameException | UnsupportedCharsetException __) {
            LangUtils.debug(log, "Unsupported charset '{}', falling back to UTF-8", cs);
          }
        }
      }
    } catch (MessagingException ex) {
      LangUtils.debug(log, "Content-Type illeggibile, uso UTF-8: {}", LangUtils.exMsg(ex));
    }
    return StandardCharsets.UTF_8;
  }

  /**
   * Testo di una parte. Jakarta Mail decodifica il transfer-encoding (QP/Base64); se il charset
   * dichiarato è sconosciuto si rilegge lo stream con il charset di ripiego.
   */
  public static String getTextPayload(@NonNull final Part part) {
    try {
      val content = part.getContent();
      if (content instanceof String s) return s;
    } catch (IOException | MessagingException ex) {
      LangUtils.debug(log, "getContent failed softly: {}", LangUtils.exMsg(ex));
    }
    try {
      @Cleanup val is = part.getInputStream();
      return readAll(is, detectCharset(part));
    } catch (IOException | MessagingException ex) {
      LangUtils.debug(log, "getTextPayload failed softly: {}", LangUtils.exMsg(ex));
    }
    return "";
  }

  /** HTML → testo; i link restano visibili come "testo url" per non perdere il segnale. */
  public static String htmlToPlainText(final String html) {
    if (LangUtils.empty(html)) return "";
    val doc = Jsoup.parse(html);
    for (val a : doc.select("a[href]")) {
      val href = a.attr("href");
      if (!LangUtils.empty(href) && !a.text().contains(href)) a.appendText(" " + href);
    }
    // Preserve logical breaks before extracting text
    doc.select("br").append("\\n");
    doc.select("p, li, div, tr, h1, h2, h3, h4, h5, h6").prepend("\\n");
    return cleanText(doc.text().replace("\\n", "\n"));
  }

  public static String readAll(@NonNull final InputStream is, @NonNull final Charset cs)
      throws IOException {
    @Cleanup val bos = new ByteArrayOutputStream();
    is.transferTo(bos);
    return bos.toString(cs);
  }

  public static String trimToMax(final String s, final int max) {
    if (s == null || s.length() <= max) return s == null ? "" : s;
    return s.substring(0, max);
  }

  /** Decodifica un header RFC 2047, safe: in caso di encoding rotto restituisce il grezzo. */
  public static String decodeHeaderSafe(final String raw) {
    if (LangUtils.empty(raw)) return "";
    try {
      return cleanText(MimeUtility.decodeText(MimeUtility.unfold(raw)));
    } catch (UnsupportedEncodingException | RuntimeException e) {
      // Fallback best-effort
      return cleanText(raw);
    }
  }

  /**
   * Converte un jakarta.mail.Message in RFC822 bytes (header + body) usando writeTo(). Usa CRLF
   * corrette e mantiene intatti gli header.
   */
  public static byte[] toRfc822Bytes(@NonNull final Message message)
      throws IOException, MessagingException {
    @Cleanup val baos = new ByteArrayOutputStream(64 * 1024);
    message.writeTo(baos);
    return baos.toByteArray();
  }

  public static void ensureOpenRO(@NonNull final Folder f) throws MessagingException {
    if (!f.isOpen()) f.open(Folder.READ_ONLY);
  }
}
