package com.github.spud.leadagent.domain.tools;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 日历适配器，进程内预约簿，不连接真实日历
 * <p>
 * 支持：book_meeting / check_availability / cancel_meeting。预约簿只保留最近 {@value #DEFAULT_CAPACITY} 条，
 * 超出后最早的预约被淘汰，之后无法再取消。
 */
@Slf4j
@Component
public class CalendarActionAdapter extends AbstractActionAdapter {

  public static final String BOOK_MEETING = "book_meeting";
  public static final String CHECK_AVAILABILITY = "check_availability";
  public static final String CANCEL_MEETING = "cancel_meeting";

  private static final List<LocalTime> DAILY_SLOTS =
    List.of(LocalTime.of(10, 0), LocalTime.of(14, 0), LocalTime.of(16, 0));
  private static final int MAX_SLOTS = 10;
  private static final String MEETING_LINK_PREFIX = "https://meet.example.com/";

  static final int DEFAULT_CAPACITY = 500;

  private final Map<String, Map<String, Object>> bookings;

  public CalendarActionAdapter() {
    this(DEFAULT_CAPACITY);
  }

  CalendarActionAdapter(int capacity) {
    this.bookings = Collections.synchronizedMap(new LinkedHashMap<String, Map<String, Object>>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Map<String, Object>> eldest) {
        return size() > capacity;
      }
    });
    register(BOOK_MEETING, this::bookMeeting);
    register(CHECK_AVAILABILITY, this::checkAvailability);
    register(CANCEL_MEETING, this::cancelMeeting);
  }

  @Override
  public ActionType type() {
    return ActionType.CALENDAR;
  }

  /**
   * 预约会议，未指定时间时默认两天后 10:00 UTC
   */
  private ToolResult bookMeeting(Map<String, Object> params) {
    String email = requireString(params, "lead_email");
    OffsetDateTime start = parseTime(optionalString(params, "preferred_time"));
    if (start == null) {
      start = LocalDate.now(ZoneOffset.UTC).plusDays(2).atTime(10, 0).atOffset(ZoneOffset.UTC);
    }
    int duration = intParam(params, "duration_minutes", 30);

    String meetingId = UUID.randomUUID().toString();
    Map<String, Object> booking = new LinkedHashMap<>();
    booking.put("meeting_id", meetingId);
    booking.put("lead_email", email);
    booking.put("lead_name", optionalString(params, "lead_name", email));
    booking.put("meeting_type", optionalString(params, "meeting_type", "discovery_call"));
    booking.put("start_time", start.toString());
    booking.put("end_time", start.plusMinutes(duration).toString());
    booking.put("meeting_link", MEETING_LINK_PREFIX + meetingId);
    bookings.put(meetingId, booking);

    log.info("Meeting booked: id={}, start={}", meetingId, start);
    return ToolResult.ok(booking);
  }

  /**
   * 查询可用时段：工作日 10/14/16 点，最多返回 10 个
   */
  private ToolResult checkAvailability(Map<String, Object> params) {
    LocalDate from = parseDate(optionalString(params, "start_date"),
      LocalDate.now(ZoneOffset.UTC).plusDays(1));
    LocalDate to = parseDate(optionalString(params, "end_date"), from.plusDays(7));

    List<String> slots = new ArrayList<>();
    for (LocalDate day = from; !day.isAfter(to) && slots.size() < MAX_SLOTS;
      day = day.plusDays(1)) {
      if (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
        continue;
      }
      for (LocalTime slot : DAILY_SLOTS) {
        if (slots.size() >= MAX_SLOTS) {
          break;
        }
        slots.add(day.atTime(slot).atOffset(ZoneOffset.UTC).toString());
      }
    }
    return ToolResult.ok(Map.of("available_slots", slots));
  }

  private ToolResult cancelMeeting(Map<String, Object> params) {
    String meetingId = requireString(params, "meeting_id");
    Map<String, Object> removed = bookings.remove(meetingId);
    if (removed == null) {
      return ToolResult.terminalFailure("Meeting not found: " + meetingId);
    }
    log.info("Meeting cancelled: id={}", meetingId);
    return ToolResult.ok(Map.of("meeting_id", meetingId, "status", "cancelled"));
  }

  int bookingCount() {
    return bookings.size();
  }

  private static OffsetDateTime parseTime(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid preferred_time: " + value, e);
    }
  }

  private static LocalDate parseDate(String value, LocalDate fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date: " + value, e);
    }
  }
}
