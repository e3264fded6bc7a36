package com.herzen.coach.api;

import com.herzen.coach.strategy.StrategyCatalog;
import com.herzen.coach.strategy.StrategyModels.StrategyView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/strategies")
public class StrategyController {
    private final StrategyCatalog catalog;

    public StrategyController(StrategyCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public ResponseEntity<List<StrategyView>> list() {
        return ResponseEntity.ok(catalog.all().stream().map(StrategyView::of).toList());
    }

    @GetMapping("/{name}")
    public ResponseEntity<StrategyView> get(@PathVariable String name) {
        return ResponseEntity.ok(StrategyView.of(catalog.get(name)));
    }
}
