package com.tsc.payment.repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.tsc.payment.entity.Payment;
import com.tsc.payment.entity.PaymentStatus;

import jakarta.persistence.LockModeType;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByTransactionId(String transactionId);

    /**
     * Row-locked lookup used when committing a callback, so two deliveries for the same
     * transaction are applied one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.transactionId = :transactionId")
    Optional<Payment> findForUpdateByTransactionId(@Param("transactionId") String transactionId);

    Optional<Payment> findByRegistrationId(Long registrationId);

    List<Payment> findAllByOrderByInitiatedAtDesc();

    List<Payment> findByStatusOrderByInitiatedAtDesc(PaymentStatus status);

    long countByStatus(PaymentStatus status);

    long countByRegistrationWorkshopIdAndStatus(Long workshopId, PaymentStatus status);

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.status = :status")
    BigDecimal sumAmountByStatus(@Param("status") PaymentStatus status);

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.registration.workshop.id = :workshopId AND p.status = :status")
    BigDecimal sumAmountByWorkshopAndStatus(@Param("workshopId") Long workshopId, @Param("status") PaymentStatus status);
}
