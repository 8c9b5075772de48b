package com.quillkv.gateway.http;

import com.quillkv.observability.DoctorCommand;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DoctorController {

    private final DoctorCommand doctor;

    public DoctorController(DoctorCommand doctor) {
        this.doctor = doctor;
    }

    @GetMapping(value = "/api/admin/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }
}
