package com.scholary.pdf.handler.api;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the processing dashboard.
 *
 * <p>The page is static and renders the history endpoints client-side.
 */
@Controller
public class DashboardController {

  @GetMapping("/")
  public String dashboard() {
    return "forward:/dashboard.html";
  }
}
