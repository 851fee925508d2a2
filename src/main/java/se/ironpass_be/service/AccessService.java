package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.response.AccessAttemptResponse;
import se.ironpass_be.dto.response.AccessVerdict;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.AccessLog;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.pojo.enums.AccessMethod;
import se.ironpass_be.repository.MemberRepository;

/**
 * Front desk operations: previewing a verdict, manual check-in and QR check-in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessService {

    private final AccessDecisionService accessDecisionService;
    private final AccessLogService accessLogService;
    private final QrTokenService qrTokenService;
    private final MemberRepository memberRepository;
    private final ModelMapper modelMapper;

    // Preview only, nothing is logged
    public AccessVerdict validateMemberAccess(Long memberId) {
        return accessDecisionService.evaluate(memberId);
    }

    /**
     * Evaluates and logs a manual check-in. An unknown member is reported, not logged.
     */
    @Transactional
    public AccessAttemptResponse registerManualAccess(Long memberId, StaffUser verifiedBy) {
        Member member = memberRepository.findById(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + memberId));

        AccessVerdict verdict = accessDecisionService.evaluate(memberId);
        AccessLog accessLog = accessLogService.record(
                member, AccessMethod.MANUAL, verdict.isAllowed(), verdict.getReason(), null, verifiedBy);

        return AccessAttemptResponse.builder()
                .accessLog(modelMapper.toAccessLogResponse(accessLog))
                .verdict(verdict)
                .build();
    }

    public AccessAttemptResponse validateQrToken(String token, StaffUser verifiedBy) {
        return qrTokenService.validateQrToken(token, verifiedBy);
    }
}
