package com.washdispatch.service;

import com.washdispatch.config.DispatchProperties;
import com.washdispatch.dto.CreateJobRequest;
import com.washdispatch.dto.CreateJobResponse;
import com.washdispatch.dto.FeeBreakdown;
import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.exception.CompanyNotFoundException;
import com.washdispatch.model.AssignmentMode;
import com.washdispatch.model.Company;
import com.washdispatch.model.Job;
import com.washdispatch.repository.CompanyRepository;
import com.washdispatch.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer side: checkout creates the job in PENDING_PAYMENT together with its payment intent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final CompanyRepository companyRepository;
    private final JobRepository jobRepository;
    private final FeeCalculator feeCalculator;
    private final PaymentGateway paymentGateway;
    private final DispatchProperties dispatchProperties;
    private final Clock clock;

    public CreateJobResponse createJob(CreateJobRequest request) {
        Company company = companyRepository.findById(request.getCompanyId())
                .filter(Company::isActive)
                .orElseThrow(() -> new CompanyNotFoundException(request.getCompanyId()));

        BigDecimal tip = request.getTipAmount() == null ? BigDecimal.ZERO : request.getTipAmount();
        FeeBreakdown fees = feeCalculator.computeFees(request.getBasePrice(), tip,
                company.getPlatformFee(), company.getFeePackageType());

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("companyId", String.valueOf(company.getId()));
        metadata.put("carPlateNumber", request.getCarPlateNumber());
        metadata.put(PaymentSucceededEvent.META_TIP_AMOUNT, fees.getTipAmount().toPlainString());
        if (request.getRequestedCleanerId() != null) {
            metadata.put(PaymentSucceededEvent.META_REQUESTED_CLEANER_ID, String.valueOf(request.getRequestedCleanerId()));
        }

        // provider first: a failed intent leaves nothing behind in the database
        PaymentIntentSummary intent = paymentGateway.createPaymentIntent(
                fees.getTotalAmount(), dispatchProperties.getCurrency(), metadata);

        Job job = new Job();
        job.setCreatedAt(clock.instant());
        job.setCompanyId(company.getId());
        job.setCustomerId(request.getCustomerId());
        job.setCustomerEmail(request.getCustomerEmail());
        job.setCustomerPhone(request.getCustomerPhone());
        job.setCarPlateNumber(request.getCarPlateNumber());
        job.setParkingNumber(request.getParkingNumber());
        job.placeAt(request.getLatitude(), request.getLongitude());
        job.setAddress(request.getAddress());
        job.setBasePrice(fees.getBaseAmount());
        job.setTipAmount(fees.getTipAmount());
        job.setTotalAmount(fees.getTotalAmount());
        job.setCurrency(dispatchProperties.getCurrency());
        job.setPaymentReference(intent.getId());
        if (request.getRequestedCleanerId() != null) {
            job.setRequestedCleanerId(request.getRequestedCleanerId());
            job.setAssignmentMode(AssignmentMode.DIRECT);
        }
        jobRepository.save(job);

        log.info("Job {} created for company {} (payment {}, total {})",
                job.getId(), company.getId(), intent.getId(), fees.getTotalAmount());
        return new CreateJobResponse(job.getId(), intent.getClientSecret(), fees.getTotalAmount());
    }

    @Transactional(readOnly = true)
    public List<Job> jobsOfCustomer(Long customerId) {
        return jobRepository.findByCustomerIdOrderByCreatedAtDesc(customerId);
    }
}
