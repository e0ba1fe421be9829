package com.family.library.controller;

import com.family.library.dto.CreateEventRequest;
import com.family.library.entity.Book;
import com.family.library.entity.Participant;
import com.family.library.storage.LibraryStorage;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON API behind the Telegram Mini App. Every call carries {@code Authorization: tma <initData>}.
 */
@RestController
@RequestMapping("/api")
public class MiniAppController {

    private static final Logger log = LoggerFactory.getLogger(MiniAppController.class);

    private static final DateTimeFormatter STRICT_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final LibraryStorage storage;
    private final InitDataValidator validator;

    public MiniAppController(LibraryStorage storage, InitDataValidator validator) {
        this.storage = storage;
        this.validator = validator;
    }

    @GetMapping("/books")
    public List<Map<String, Object>> books(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        validator.authenticate(auth);
        return storage.listReadableBooks().stream().map(MiniAppController::bookJson).collect(Collectors.toList());
    }

    @GetMapping("/participants")
    public List<Map<String, Object>> participants(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        validator.authenticate(auth);
        return storage.listParticipants().stream().map(MiniAppController::participantJson).collect(Collectors.toList());
    }

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, String> createEvent(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                           @Valid @RequestBody CreateEventRequest request) {
        long userId = validator.authenticate(auth);
        LocalDate date;
        try {
            date = LocalDate.parse(request.getDate(), STRICT_DATE);
        } catch (DateTimeParseException e) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "invalid date " + request.getDate());
        }
        storage.createEvent(date, request.getBookName().trim(), request.getParticipantName().trim());
        log.info("[{}] Mini App reading event | date={} book={} reader={}",
                userId, date, request.getBookName(), request.getParticipantName());
        return Map.of("status", "created");
    }

    private static Map<String, Object> bookJson(Book book) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", book.getId());
        json.put("name", book.getName());
        return json;
    }

    private static Map<String, Object> participantJson(Participant participant) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", participant.getId());
        json.put("name", participant.getName());
        json.put("is_parent", participant.isParent());
        return json;
    }
}
