package com.tsc.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tsc.entity.School;

public interface ISchoolRepository extends JpaRepository<School, Long> {

	Optional<School> findByName(String name);

	List<School> findByActiveTrueOrderByNameAsc();

	List<School> findAllByOrderByNameAsc();
}
