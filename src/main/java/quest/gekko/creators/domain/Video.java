package quest.gekko.creators.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "video", uniqueConstraints = @UniqueConstraint(columnNames = { "creator_id", "video_id" }))
@Getter @Setter
public class Video {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "creator_id", nullable = false)
    Creator creator;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @Column(length = 2200)
    String caption;

    @Column(length = 1000)
    String hashtags;

    // null when the scrape could not read a timestamp
    Instant postedAt;

    long views;
    long likes;
    long comments;
    long shares;

    Double durationSeconds;
}
