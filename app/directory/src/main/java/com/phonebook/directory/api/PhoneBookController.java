package com.phonebook.directory.api;

import com.phonebook.directory.api.request.AddPersonRequest;
import com.phonebook.directory.api.response.ContactResponse;
import com.phonebook.directory.api.response.MessageResponse;
import com.phonebook.directory.service.DirectoryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/PhoneBook")
@RequiredArgsConstructor
public class PhoneBookController {

  private final DirectoryService directoryService;

  @GetMapping("/list")
  public List<ContactResponse> list() {
    return directoryService.listContacts().stream().map(ContactResponse::from).toList();
  }

  @PostMapping("/add")
  public ResponseEntity<MessageResponse> add(@RequestBody AddPersonRequest request) {
    directoryService.addPerson(request.fullName(), request.phoneNumber());
    return ResponseEntity.ok(new MessageResponse(MessageResponse.PERSON_ADDED));
  }

  /**
   * Deletes the contact whose full name matches exactly.
   *
   * <p>400 when the name is malformed, 404 when no contact has it.
   */
  @PutMapping("/deleteByName")
  public ResponseEntity<MessageResponse> deleteByName(
      @RequestParam("full_name") String fullName) {
    directoryService.deleteByName(fullName);
    return ResponseEntity.ok(new MessageResponse(MessageResponse.PERSON_DELETED));
  }

  /**
   * Deletes the contact whose phone number matches exactly.
   *
   * <p>400 when the number is malformed, 404 when no contact has it.
   */
  @PutMapping("/deleteByNumber")
  public ResponseEntity<MessageResponse> deleteByNumber(
      @RequestParam("phone_number") String phoneNumber) {
    directoryService.deleteByNumber(phoneNumber);
    return ResponseEntity.ok(new MessageResponse(MessageResponse.PERSON_DELETED));
  }
}
