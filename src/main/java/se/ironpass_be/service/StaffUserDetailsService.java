package se.ironpass_be.service;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironpass_be.pojo.StaffUser;
import se.ironpass_be.repository.StaffUserRepository;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class StaffUserDetailsService implements UserDetailsService {

    private final StaffUserRepository staffUserRepository;

    public StaffUserDetailsService(StaffUserRepository staffUserRepository) {
        this.staffUserRepository = staffUserRepository;
    }

    @Override
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        StaffUser staff = staffUserRepository.findByEmail(email)
                .orElseThrow(() -> new UsernameNotFoundException("Staff user not found: " + email));

        List<GrantedAuthority> authorities = List.of(new SimpleGrantedAuthority("ROLE_" + staff.getRole().name()));

        return org.springframework.security.core.userdetails.User.builder()
                .username(staff.getEmail())
                .password(staff.getPasswordHash())
                .disabled(!staff.isActive())
                .authorities(authorities)
                .build();
    }
}
