package com.tsc.service;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tsc.entity.Registration;
import com.tsc.entity.School;
import com.tsc.exception.ResourceNotFoundException;
import com.tsc.repository.IRegistrationRepository;
import com.tsc.repository.ISchoolRepository;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class SchoolService {

    @Autowired
    private ISchoolRepository schoolRepository;

    @Autowired
    private IRegistrationRepository registrationRepository;

    @Transactional(readOnly = true)
    public List<School> getActiveSchools() {
        return schoolRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<School> getAllSchools() {
        return schoolRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public School createSchool(String name) {
        String trimmed = name.trim();
        if (schoolRepository.findByName(trimmed).isPresent()) {
            throw new IllegalStateException("School already exists: " + trimmed);
        }
        School saved = schoolRepository.save(new School(trimmed));
        log.info("Created school {} '{}'", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public School deactivateSchool(Long id) {
        School school = schoolRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("School not found: " + id));
        school.setActive(false);
        log.info("Deactivated school {} '{}'", id, school.getName());
        return schoolRepository.save(school);
    }

    /**
     * Links registrations that only carry a free-text school name to a School record,
     * creating the school when no record with that name exists.
     *
     * @return number of registrations linked
     */
    @Transactional
    public int backfillSchools() {
        List<Registration> unlinked = registrationRepository.findBySchoolIsNullAndLegacySchoolNameIsNotNull();
        int linked = 0;
        int created = 0;

        for (Registration registration : unlinked) {
            String name = registration.getLegacySchoolName().trim();
            if (name.isEmpty()) {
                continue;
            }
            School school = schoolRepository.findByName(name).orElse(null);
            if (school == null) {
                school = schoolRepository.save(new School(name));
                created++;
            }
            registration.setSchool(school);
            registrationRepository.save(registration);
            linked++;
        }

        log.info("School backfill linked {} registrations, created {} schools", linked, created);
        return linked;
    }
}
