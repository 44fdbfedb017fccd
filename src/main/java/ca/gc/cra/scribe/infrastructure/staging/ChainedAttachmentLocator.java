package ca.gc.cra.scribe.infrastructure.staging;

import ca.gc.cra.scribe.application.port.AttachmentLocator;
import ca.gc.cra.scribe.domain.msg.AttachmentRow;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Tries locators in order and returns the first hit.
 *
 * <p>An {@link IOException} from one locator is remembered and rethrown only when no later locator
 * resolves the attachment, so a readable copy elsewhere still wins.</p>
 *
 * @since 0.1.0
 */
public final class ChainedAttachmentLocator implements AttachmentLocator {
  private final List<AttachmentLocator> locators;

  public ChainedAttachmentLocator(List<AttachmentLocator> locators) {
    this.locators = List.copyOf(locators);
  }

  @Override
  public Optional<ResolvedAttachment> locate(AttachmentRow attachment) throws IOException {
    IOException first = null;
    for (AttachmentLocator locator : locators) {
      try {
        Optional<ResolvedAttachment> resolved = locator.locate(attachment);
        if (resolved.isPresent()) {
          return resolved;
        }
      } catch (IOException ex) {
        if (first == null) {
          first = ex;
        } else {
          first.addSuppressed(ex);
        }
      }
    }
    if (first != null) {
      throw first;
    }
    return Optional.empty();
  }
}
