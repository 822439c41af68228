package org.danilorossi.mailguard.decode;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.helpers.MailUtils;
import org.danilorossi.mailguard.model.DecodedMessage;
import org.danilorossi.mailguard.model.RawMessage;

/**
 * Trasforma i byte RFC822 scaricati in campi normalizzati.
 *
 * <p>Header con encoding rotti vengono decodificati best-effort (ripiego sul valore grezzo). Il
 * body è la concatenazione di tutte le parti text/plain; se non ce n'è nessuna si usano le parti
 * text/html convertite in testo. Il flag allegati si accende per qualunque parte con una
 * Content-Disposition diversa da inline.
 */
@Log
public class MessageDecoder {

  static {
    LogConfigurator.configLog(log);
  }

  /** Multipart annidati oltre questa profondità vengono ignorati. */
  private static final int MAX_DEPTH = 16;

  private final Session session = Session.getInstance(new Properties());

  public DecodedMessage decode(@NonNull final RawMessage raw) throws DecodeException {
    val id = raw.getMessageId();
    if (raw.getPayload().length == 0) throw new DecodeException(id, "Empty payload");

    final MimeMessage mime;
    try {
      mime = new MimeMessage(session, new ByteArrayInputStream(raw.getPayload()));
    } catch (MessagingException ex) {
      throw new DecodeException(id, "Unparseable message: " + LangUtils.exMsg(ex), ex);
    }

    val sender = header(mime, "From");
    val parts = new BodyParts();
    try {
      walk(mime, parts, 0);
    } catch (MessagingException | IOException ex) {
      // struttura MIME rotta: meglio il grezzo che niente
      LangUtils.debug(log, "MIME walk failed for {}: {}", id, LangUtils.exMsg(ex));
      parts.plain.add(rawBody(mime));
    }

    return DecodedMessage.builder()
        .messageId(id)
        .subject(header(mime, "Subject"))
        .sender(sender)
        .senderDomain(senderDomain(sender))
        .recipient(header(mime, "To"))
        .body(MailUtils.trimToMax(parts.body(), MailUtils.MAX_OUTPUT_CHARS))
        .size(raw.getPayload().length)
        .hasAttachments(parts.attachment)
        .receivedAtEpochMs(
            raw.getReceivedAtEpochMs() != null ? raw.getReceivedAtEpochMs() : sentDate(mime))
        .build();
  }

  /* =================== Helpers =================== */

  private static final class BodyParts {
    private final List<String> plain = new ArrayList<>();
    private final List<String> html = new ArrayList<>();
    private boolean attachment;

    String body() {
      if (!plain.isEmpty()) return String.join("\n", plain).trim();
      val sb = new StringBuilder();
      for (val h : html) sb.append(MailUtils.htmlToPlainText(h)).append('\n');
      return sb.toString().trim();
    }
  }

  private void walk(final Part part, final BodyParts out, final int depth)
      throws MessagingException, IOException {
    if (depth > MAX_DEPTH) return;

    if (part.isMimeType("multipart/*")) {
      val content = part.getContent();
      if (content instanceof Multipart mp) {
        for (int i = 0; i < mp.getCount(); i++) {
          try {
            walk(mp.getBodyPart(i), out, depth + 1);
          } catch (MessagingException | IOException ex) {
            LangUtils.debug(log, "Skipping subpart {} on error: {}", i, LangUtils.exMsg(ex));
          }
        }
      }
      return;
    }

    if (isAttachment(part)) out.attachment = true;

    if (part.isMimeType("text/plain")) {
      out.plain.add(MailUtils.getTextPayload(part));
    } else if (part.isMimeType("text/html")) {
      out.html.add(MailUtils.getTextPayload(part));
    }
  }

  private static boolean isAttachment(final Part part) {
    try {
      val disp = part.getDisposition();
      return disp != null && !disp.equalsIgnoreCase(Part.INLINE);
    } catch (MessagingException ex) {
      // Content-Disposition presente ma illeggibile: la parte dichiara comunque qualcosa
      return true;
    }
  }

  private static String header(final MimeMessage mime, final String name) {
    try {
      return MailUtils.decodeHeaderSafe(mime.getHeader(name, ", "));
    } catch (MessagingException ex) {
      return "";
    }
  }

  private static String rawBody(final MimeMessage mime) {
    try {
      return MailUtils.readAll(mime.getRawInputStream(), MailUtils.detectCharset(mime));
    } catch (MessagingException | IOException ex) {
      return "";
    }
  }

  private static Long sentDate(final Message mime) {
    try {
      val d = mime.getSentDate();
      return d == null ? null : d.getTime();
    } catch (MessagingException ex) {
      return null;
    }
  }

  /** "Name <user@Example.com>" → "example.com". */
  static String senderDomain(final String sender) {
    if (LangUtils.empty(sender)) return "";
    String address = null;
    try {
      val parsed = InternetAddress.parseHeader(sender, false);
      if (parsed.length > 0) address = parsed[0].getAddress();
    } catch (AddressException ex) {
      LangUtils.debug(log, "Indirizzo non RFC822 '{}': {}", sender, LangUtils.exMsg(ex));
    }
    if (address == null) address = sender;
    val at = address.lastIndexOf('@');
    if (at < 0) return "";
    var domain = address.substring(at + 1);
    val gt = domain.indexOf('>');
    if (gt >= 0) domain = domain.substring(0, gt);
    return domain.trim().toLowerCase(Locale.ROOT);
  }
}
