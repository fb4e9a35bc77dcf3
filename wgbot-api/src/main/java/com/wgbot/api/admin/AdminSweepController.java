package com.wgbot.api.admin;

import com.wgbot.application.lifecycle.SweepScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/sweeps")
public class AdminSweepController {

  private final SweepScheduler scheduler;

  public AdminSweepController(SweepScheduler scheduler) {
    this.scheduler = scheduler;
  }

  /**
   * Triggers one sweep now. Never runs concurrently with a scheduled sweep.
   */
  @PostMapping
  public ResponseEntity<Map<String, Object>> trigger() {
    if (!scheduler.tick()) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
          "status", "skipped",
          "message", "a sweep is already running"
      ));
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
        "status", "accepted",
        "periodic", scheduler.isRunning()
    ));
  }
}
