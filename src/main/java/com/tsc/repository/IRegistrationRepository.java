package com.tsc.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.tsc.entity.Registration;
import com.tsc.entity.RegistrationStatus;

public interface IRegistrationRepository extends JpaRepository<Registration, Long> {

	Optional<Registration> findByRegistrationNumber(String registrationNumber);

	boolean existsByRegistrationNumber(String registrationNumber);

	boolean existsByEmailAndWorkshopId(String email, Long workshopId);

	boolean existsByWorkshopId(Long workshopId);

	/**
	 * Seats taken: completed registrations, plus free ones while the workshop is still free.
	 */
	@Query("SELECT COUNT(r) FROM Registration r WHERE r.workshop.id = :workshopId " +
	       "AND (r.paymentStatus = com.tsc.entity.RegistrationStatus.COMPLETED " +
	       "OR (r.paymentStatus = com.tsc.entity.RegistrationStatus.FREE AND r.workshop.fee = 0))")
	long countConfirmedByWorkshopId(@Param("workshopId") Long workshopId);

	long countByWorkshopId(Long workshopId);

	long countByWorkshopIdAndPaymentStatus(Long workshopId, RegistrationStatus paymentStatus);

	long countByPaymentStatus(RegistrationStatus paymentStatus);

	List<Registration> findTop10ByOrderByRegisteredAtDesc();

	List<Registration> findBySchoolIsNullAndLegacySchoolNameIsNotNull();

	@Query("SELECT r FROM Registration r LEFT JOIN r.school s WHERE " +
	       "(:workshopId IS NULL OR r.workshop.id = :workshopId) " +
	       "AND (:status IS NULL OR r.paymentStatus = :status) " +
	       "AND (:search IS NULL OR LOWER(r.registrationNumber) LIKE :search " +
	       "OR LOWER(r.studentName) LIKE :search OR LOWER(r.email) LIKE :search " +
	       "OR LOWER(s.name) LIKE :search OR LOWER(r.legacySchoolName) LIKE :search) " +
	       "ORDER BY r.registeredAt DESC")
	List<Registration> search(@Param("workshopId") Long workshopId,
	                          @Param("status") RegistrationStatus status,
	                          @Param("search") String search);
}
