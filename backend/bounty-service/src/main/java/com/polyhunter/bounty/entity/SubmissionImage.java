package com.polyhunter.bounty.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * SubmissionImage entity - one delivered photo of a submission
 */
@Entity
@Table(name = "submission_images")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmissionImage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "submission_id", nullable = false)
    private UUID submissionId;

    @Column(name = "file_path", nullable = false)
    private String filePath;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
