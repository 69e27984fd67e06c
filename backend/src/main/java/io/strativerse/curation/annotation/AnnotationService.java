package io.strativerse.curation.annotation;

import io.strativerse.curation.audit.AuditEventBuilder;
import io.strativerse.curation.audit.AuditService;
import io.strativerse.curation.exception.ResourceConflictException;
import io.strativerse.curation.exception.ResourceNotFoundException;
import io.strativerse.curation.exception.ValidationException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generic tag and attachment store. Public attach/delete calls are audited; the bulk helpers
 * ({@link #replaceTags}, {@link #transferAll}, {@link #deleteAll}) run inside a caller's operation
 * and leave auditing to it.
 */
@Service
public class AnnotationService {

  private static final Logger log = LoggerFactory.getLogger(AnnotationService.class);

  public static final int MAX_KEY_LENGTH = 55;

  private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

  private final TagRepository tagRepository;
  private final AttachmentRepository attachmentRepository;
  private final AnnotationOwnerRegistry ownerRegistry;
  private final AuditService auditService;

  public AnnotationService(
      TagRepository tagRepository,
      AttachmentRepository attachmentRepository,
      AnnotationOwnerRegistry ownerRegistry,
      AuditService auditService) {
    this.tagRepository = tagRepository;
    this.attachmentRepository = attachmentRepository;
    this.ownerRegistry = ownerRegistry;
    this.auditService = auditService;
  }

  /** Checks that an annotation key is 1..55 characters from {@code [A-Za-z0-9_]}. */
  public static void validateKey(String key) {
    if (key == null || !KEY_PATTERN.matcher(key).matches()) {
      throw new ValidationException(
          "Invalid annotation key", "Must only contain alphanumerics or the underscore: " + key);
    }
    if (key.length() > MAX_KEY_LENGTH) {
      throw new ValidationException(
          "Invalid annotation key", "Key must be at most " + MAX_KEY_LENGTH + " characters");
    }
  }

  private static void validateType(String type) {
    if (type == null || type.isBlank() || type.length() > MAX_KEY_LENGTH) {
      throw new ValidationException(
          "Invalid annotation type", "Type must be 1.." + MAX_KEY_LENGTH + " characters");
    }
  }

  @Transactional
  public Tag attachTag(
      AnnotationOwner owner, String type, String key, String value, String comment) {
    validateType(type);
    validateKey(key);
    ownerRegistry.requireExists(owner);
    if (tagRepository.findByOwnerAndTypeAndKey(owner.kind(), owner.id(), type, key).isPresent()) {
      throw new ResourceConflictException(
          "Duplicate tag",
          "A " + type + " tag with key '" + key + "' already exists on this "
              + owner.kind().label());
    }

    Tag tag;
    try {
      tag = tagRepository.saveAndFlush(new Tag(owner, type, key, value, comment));
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate tag", "A " + type + " tag with key '" + key + "' already exists");
    }

    log.info("Attached tag: owner={}/{}, type={}, key={}", owner.kind(), owner.id(), type, key);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("tag.created")
            .entityType(owner.kind().label())
            .entityId(owner.id())
            .comment(comment)
            .details(tagDetails(type, key, value))
            .build());
    return tag;
  }

  @Transactional
  public Attachment attachFile(
      AnnotationOwner owner,
      String type,
      String key,
      String fileRef,
      String fileName,
      String comment) {
    validateType(type);
    validateKey(key);
    if (fileRef == null || fileRef.isBlank()) {
      throw new ValidationException("Invalid attachment", "A file reference is required");
    }
    ownerRegistry.requireExists(owner);
    if (attachmentRepository
        .findByOwnerAndTypeAndKey(owner.kind(), owner.id(), type, key)
        .isPresent()) {
      throw new ResourceConflictException(
          "Duplicate attachment",
          "A " + type + " attachment with key '" + key + "' already exists");
    }

    Attachment attachment;
    try {
      attachment =
          attachmentRepository.saveAndFlush(
              new Attachment(owner, type, key, fileRef, fileName, comment));
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate attachment",
          "A " + type + " attachment with key '" + key + "' already exists");
    }

    log.info(
        "Attached file: owner={}/{}, type={}, key={}, fileRef={}",
        owner.kind(),
        owner.id(),
        type,
        key,
        fileRef);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("attachment.created")
            .entityType(owner.kind().label())
            .entityId(owner.id())
            .comment(comment)
            .details(Map.of("type", type, "key", key, "file_ref", fileRef))
            .build());
    return attachment;
  }

  @Transactional(readOnly = true)
  public List<Tag> listTags(AnnotationOwner owner) {
    return tagRepository.findByOwner(owner.kind(), owner.id());
  }

  @Transactional(readOnly = true)
  public List<Tag> listTags(AnnotationOwner owner, String type) {
    return tagRepository.findByOwnerAndType(owner.kind(), owner.id(), type);
  }

  @Transactional(readOnly = true)
  public List<Attachment> listAttachments(AnnotationOwner owner) {
    return attachmentRepository.findByOwner(owner.kind(), owner.id());
  }

  @Transactional(readOnly = true)
  public List<Attachment> listAttachments(AnnotationOwner owner, String type) {
    return attachmentRepository.findByOwnerAndType(owner.kind(), owner.id(), type);
  }

  @Transactional
  public void deleteTag(AnnotationOwner owner, String type, String key) {
    var tag =
        tagRepository
            .findByOwnerAndTypeAndKey(owner.kind(), owner.id(), type, key)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Tag not found", "No " + type + " tag with key '" + key + "'"));
    tagRepository.delete(tag);

    log.info("Deleted tag: owner={}/{}, type={}, key={}", owner.kind(), owner.id(), type, key);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("tag.deleted")
            .entityType(owner.kind().label())
            .entityId(owner.id())
            .details(tagDetails(type, key, tag.getValue()))
            .build());
  }

  @Transactional
  public void deleteAttachment(AnnotationOwner owner, String type, String key) {
    var attachment =
        attachmentRepository
            .findByOwnerAndTypeAndKey(owner.kind(), owner.id(), type, key)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Attachment not found",
                        "No " + type + " attachment with key '" + key + "'"));
    attachmentRepository.delete(attachment);

    log.info(
        "Deleted attachment: owner={}/{}, type={}, key={}", owner.kind(), owner.id(), type, key);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("attachment.deleted")
            .entityType(owner.kind().label())
            .entityId(owner.id())
            .details(Map.of("type", type, "key", key, "file_ref", attachment.getFileRef()))
            .build());
  }

  /**
   * Clears every tag of {@code type} on the owner and writes {@code values} in their place. Keys
   * are validated before anything is deleted.
   */
  @Transactional
  public List<Tag> replaceTags(AnnotationOwner owner, String type, Map<String, String> values) {
    validateType(type);
    values.keySet().forEach(AnnotationService::validateKey);
    tagRepository.deleteByOwnerAndType(owner.kind(), owner.id(), type);
    var tags =
        values.entrySet().stream()
            .map(e -> new Tag(owner, type, e.getKey(), e.getValue(), null))
            .toList();
    return tagRepository.saveAll(tags);
  }

  @Transactional
  public int clearTags(AnnotationOwner owner, String type) {
    return tagRepository.deleteByOwnerAndType(owner.kind(), owner.id(), type);
  }

  /** Removes every tag and attachment of an owner that is being deleted. */
  @Transactional
  public void deleteAll(AnnotationOwner owner) {
    int tags = tagRepository.deleteByOwner(owner.kind(), owner.id());
    int attachments = attachmentRepository.deleteByOwner(owner.kind(), owner.id());
    log.debug(
        "Removed annotations of {}/{}: tags={}, attachments={}",
        owner.kind(),
        owner.id(),
        tags,
        attachments);
  }

  /**
   * Moves every tag and attachment of {@code from} to {@code to}. When {@code to} already has an
   * annotation with the same (type, key), its copy is kept and the one from {@code from} is
   * deleted.
   */
  @Transactional
  public TransferResult transferAll(AnnotationOwner from, AnnotationOwner to) {
    Set<String> taken = new HashSet<>();
    tagRepository
        .findByOwner(to.kind(), to.id())
        .forEach(t -> taken.add(slot(t.getType(), t.getKey())));
    int moved = 0;
    int discarded = 0;
    for (Tag tag : tagRepository.findByOwner(from.kind(), from.id())) {
      if (taken.add(slot(tag.getType(), tag.getKey()))) {
        tag.moveTo(to);
        moved++;
      } else {
        tagRepository.delete(tag);
        discarded++;
      }
    }

    taken.clear();
    attachmentRepository
        .findByOwner(to.kind(), to.id())
        .forEach(a -> taken.add(slot(a.getType(), a.getKey())));
    for (Attachment attachment : attachmentRepository.findByOwner(from.kind(), from.id())) {
      if (taken.add(slot(attachment.getType(), attachment.getKey()))) {
        attachment.moveTo(to);
        moved++;
      } else {
        attachmentRepository.delete(attachment);
        discarded++;
      }
    }
    tagRepository.flush();

    log.debug(
        "Transferred annotations {}/{} -> {}/{}: moved={}, discarded={}",
        from.kind(),
        from.id(),
        to.kind(),
        to.id(),
        moved,
        discarded);
    return new TransferResult(moved, discarded);
  }

  private static String slot(String type, String key) {
    return type + "\u0000" + key;
  }

  private static Map<String, Object> tagDetails(String type, String key, String value) {
    var details = new LinkedHashMap<String, Object>();
    details.put("type", type);
    details.put("key", key);
    details.put("value", value);
    return details;
  }
}
