package com.flamingo.ai.chatsearch.api.rest;

import com.flamingo.ai.chatsearch.api.dto.request.IndexMessageRequest;
import com.flamingo.ai.chatsearch.api.dto.request.IndexRoomRequest;
import com.flamingo.ai.chatsearch.api.dto.request.IndexUserRequest;
import com.flamingo.ai.chatsearch.api.dto.response.MessageResponse;
import com.flamingo.ai.chatsearch.api.dto.response.RoomResponse;
import com.flamingo.ai.chatsearch.api.dto.response.UserResponse;
import com.flamingo.ai.chatsearch.service.search.SearchOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for adding messages, users and rooms to the search indices. */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
public class IndexController {

  private final SearchOrchestrator searchOrchestrator;

  /** Indexes a chat message. The server assigns the timestamp, and the id when absent. */
  @PostMapping("/messages")
  public ResponseEntity<MessageResponse> indexMessage(
      @Valid @RequestBody IndexMessageRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(MessageResponse.from(searchOrchestrator.indexMessage(request.toDocument())));
  }

  @PostMapping("/users")
  public ResponseEntity<UserResponse> indexUser(@Valid @RequestBody IndexUserRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(UserResponse.from(searchOrchestrator.indexUser(request.toDocument())));
  }

  @PostMapping("/rooms")
  public ResponseEntity<RoomResponse> indexRoom(@Valid @RequestBody IndexRoomRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(RoomResponse.from(searchOrchestrator.indexRoom(request.toDocument())));
  }
}
