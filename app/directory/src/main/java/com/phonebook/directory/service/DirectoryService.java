/*
 * Where: Directory service layer
 * What: validate -> read -> mutate -> audit for each phonebook operation
 * Why: the phonebook and the audit trail are separate stores, so the order of writes is explicit here
 */
package com.phonebook.directory.service;

import com.phonebook.directory.api.InvalidPersonInputException;
import com.phonebook.directory.api.PersonConflictException;
import com.phonebook.directory.api.PersonConflictException.ConflictKind;
import com.phonebook.directory.api.PersonNotFoundException;
import com.phonebook.directory.model.AuditAction;
import com.phonebook.directory.model.AuditLogRecord;
import com.phonebook.directory.model.ContactRecord;
import com.phonebook.directory.repository.AuditLogRepository;
import com.phonebook.directory.repository.ContactRepository;
import com.phonebook.directory.validation.ContactFormatValidator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Phonebook operations.
 *
 * <p>The contact write and the audit write are not atomic: if the audit insert fails after the
 * contact was stored or deleted, the error propagates and the contact change stays. Audit entries
 * are only written once the operation has succeeded.
 */
@Service
@RequiredArgsConstructor
public class DirectoryService {

  private static final Logger logger = LoggerFactory.getLogger(DirectoryService.class);

  private final ContactRepository contactRepository;
  private final AuditLogRepository auditLogRepository;
  private final DirectoryMetrics metrics;
  private final Clock clock;

  /** Returns every contact and records a {@code list} audit entry. */
  public List<ContactRecord> listContacts() {
    return track(
        AuditAction.LIST,
        () -> {
          final List<ContactRecord> contacts = contactRepository.findAll();
          audit(AuditAction.LIST, "", "");
          return contacts;
        });
  }

  /**
   * Adds a contact.
   *
   * @throws InvalidPersonInputException if the name or the number is malformed
   * @throws PersonConflictException if the number, or else the name, is already stored
   */
  public ContactRecord addPerson(String fullName, String phoneNumber) {
    return track(
        AuditAction.ADD,
        () -> {
          requireValidFullName(fullName);
          requireValidPhoneNumber(phoneNumber);
          rejectDuplicate(fullName, phoneNumber);

          final ContactRecord created;
          try {
            created = contactRepository.insert(fullName, phoneNumber);
          } catch (DuplicateKeyException ex) {
            // Lost the race against a concurrent add; report it like the pre-check would have.
            rejectDuplicate(fullName, phoneNumber);
            throw ex;
          }
          logger.info("contact added id={}", created.id());
          audit(AuditAction.ADD, created.fullName(), created.phoneNumber());
          return created;
        });
  }

  /**
   * Deletes the contact with exactly this full name.
   *
   * @throws InvalidPersonInputException if the name is malformed
   * @throws PersonNotFoundException if no contact has the name
   */
  public ContactRecord deleteByName(String fullName) {
    return track(
        AuditAction.DELETE_BY_NAME,
        () -> {
          requireValidFullName(fullName);
          return deleteAndAudit(
              AuditAction.DELETE_BY_NAME, () -> contactRepository.deleteByFullName(fullName));
        });
  }

  /**
   * Deletes the contact with exactly this phone number.
   *
   * @throws InvalidPersonInputException if the number is malformed
   * @throws PersonNotFoundException if no contact has the number
   */
  public ContactRecord deleteByNumber(String phoneNumber) {
    return track(
        AuditAction.DELETE_BY_NUMBER,
        () -> {
          requireValidPhoneNumber(phoneNumber);
          return deleteAndAudit(
              AuditAction.DELETE_BY_NUMBER,
              () -> contactRepository.deleteByPhoneNumber(phoneNumber));
        });
  }

  private ContactRecord deleteAndAudit(
      AuditAction action, Supplier<Optional<ContactRecord>> deletion) {
    final ContactRecord deleted = deletion.get().orElseThrow(PersonNotFoundException::new);
    logger.info("contact deleted id={} action={}", deleted.id(), action.tag());
    // The audit entry carries the stored values of the deleted row.
    audit(action, deleted.fullName(), deleted.phoneNumber());
    return deleted;
  }

  private void rejectDuplicate(String fullName, String phoneNumber) {
    if (contactRepository.findByPhoneNumber(phoneNumber).isPresent()) {
      throw new PersonConflictException(ConflictKind.PHONE_NUMBER);
    }
    if (contactRepository.findByFullName(fullName).isPresent()) {
      throw new PersonConflictException(ConflictKind.FULL_NAME);
    }
  }

  private void requireValidFullName(String fullName) {
    if (!ContactFormatValidator.validateFullName(fullName)) {
      throw new InvalidPersonInputException();
    }
  }

  private void requireValidPhoneNumber(String phoneNumber) {
    if (!ContactFormatValidator.validatePhoneNumber(phoneNumber)) {
      throw new InvalidPersonInputException();
    }
  }

  private void audit(AuditAction action, String fullName, String phoneNumber) {
    final Instant now = Instant.now(clock);
    auditLogRepository.insert(AuditLogRecord.pending(now, action, fullName, phoneNumber));
  }

  private <T> T track(AuditAction action, Supplier<T> operation) {
    try {
      final T result = operation.get();
      metrics.recordRequest(action, DirectoryMetrics.RESULT_SUCCESS);
      return result;
    } catch (InvalidPersonInputException ex) {
      metrics.recordRequest(action, DirectoryMetrics.RESULT_INVALID_INPUT);
      throw ex;
    } catch (PersonConflictException ex) {
      metrics.recordRequest(action, DirectoryMetrics.RESULT_CONFLICT);
      throw ex;
    } catch (PersonNotFoundException ex) {
      metrics.recordRequest(action, DirectoryMetrics.RESULT_NOT_FOUND);
      throw ex;
    } catch (RuntimeException ex) {
      metrics.recordRequest(action, DirectoryMetrics.RESULT_ERROR);
      throw ex;
    }
  }
}
