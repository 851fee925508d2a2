package se.ironpass_be.service;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.exception.ResourceNotFoundException;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.repository.StaffUserRepository;

@Service
@RequiredArgsConstructor
public class StaffService {

    private final StaffUserRepository staffUserRepository;

    // The staff row behind the authenticated principal
    @Transactional(readOnly = true)
    public StaffUser getCurrentStaff(UserDetails currentUser) {
        return staffUserRepository.findByEmail(currentUser.getUsername())
                .orElseThrow(() -> new ResourceNotFoundException("Staff user not found: " + currentUser.getUsername()));
    }
}
