package com.tsc.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tsc.dto.WorkshopResponseDTO;
import com.tsc.entity.School;
import com.tsc.service.SchoolService;
import com.tsc.service.WorkshopService;

@RestController
@RequestMapping("/api")
public class WorkshopController {

    @Autowired
    private WorkshopService workshopService;

    @Autowired
    private SchoolService schoolService;

    @GetMapping("/workshops")
    public ResponseEntity<List<WorkshopResponseDTO>> getWorkshops() {
        return ResponseEntity.ok(workshopService.getActiveWorkshops());
    }

    @GetMapping("/workshops/{id}")
    public ResponseEntity<WorkshopResponseDTO> getWorkshop(@PathVariable Long id) {
        return ResponseEntity.ok(workshopService.getActiveWorkshop(id));
    }

    @GetMapping("/schools")
    public ResponseEntity<List<School>> getSchools() {
        return ResponseEntity.ok(schoolService.getActiveSchools());
    }
}
