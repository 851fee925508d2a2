package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.dto.request.MemberRequest;
import se.ironpass_be.dto.response.MemberResponse;
import se.ironpass_be.dto.response.PagedResponse;
import se.ironpass_be.exception.BusinessLogicException;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.mapper.ModelMapper;
import se.ironpass_be.pojo.Member;
import se.ironpass_be.repository.MemberRepository;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class MemberService {

    private final MemberRepository memberRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public PagedResponse<MemberResponse> getMembers(Pageable pageable, String search) {
        Page<Member> members;
        if (search == null || search.isBlank()) {
            members = memberRepository.findAll(pageable);
        } else {
            String term = search.trim();
            members = memberRepository
                    .findByFirstNameContainingIgnoreCaseOrLastNameContainingIgnoreCaseOrEmailContainingIgnoreCase(
                            term, term, term, pageable);
        }
        return PagedResponse.of(members.map(modelMapper::toMemberResponse));
    }

    @Transactional(readOnly = true)
    public MemberResponse getMember(Long memberId) {
        return modelMapper.toMemberResponse(findMember(memberId));
    }

    @Transactional
    public MemberResponse createMember(MemberRequest request) {
        String email = normalizeEmail(request.getEmail());
        if (memberRepository.existsByEmail(email)) {
            throw new BusinessLogicException("A member with this email already exists");
        }

        Member member = memberRepository.save(Member.builder()
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .email(email)
                .phone(request.getPhone())
                .notes(request.getNotes())
                .build());

        log.info("Created member {}", member.getMemberId());
        return modelMapper.toMemberResponse(member);
    }

    @Transactional
    public MemberResponse updateMember(Long memberId, MemberRequest request) {
        Member member = findMember(memberId);
        String email = normalizeEmail(request.getEmail());
        if (!email.equals(member.getEmail()) && memberRepository.existsByEmail(email)) {
            throw new BusinessLogicException("A member with this email already exists");
        }

        member.setFirstName(request.getFirstName().trim());
        member.setLastName(request.getLastName().trim());
        member.setEmail(email);
        member.setPhone(request.getPhone());
        member.setNotes(request.getNotes());
        return modelMapper.toMemberResponse(memberRepository.save(member));
    }

    // Inactive members are denied at the door and cannot get a QR code
    @Transactional
    public MemberResponse setActive(Long memberId, boolean active) {
        Member member = findMember(memberId);
        member.setActive(active);
        memberRepository.save(member);
        log.info("Member {} {}", memberId, active ? "activated" : "deactivated");
        return modelMapper.toMemberResponse(member);
    }

    private Member findMember(Long memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found with id: " + memberId));
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
