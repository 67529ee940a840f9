package com.tsc.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.tsc.entity.Workshop;

public interface IWorkshopRepository extends JpaRepository<Workshop, Long> {

	List<Workshop> findByActiveTrueOrderByWorkshopDateAscNameAsc();

	List<Workshop> findAllByOrderByWorkshopDateAscNameAsc();

	long countByActiveTrue();
}
