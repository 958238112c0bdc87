package quest.gekko.creators.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "creator", uniqueConstraints = @UniqueConstraint(columnNames = { "handle" }))
@Getter @Setter
public class Creator {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, length = 30)
    String handle;

    @Column(nullable = false)
    String niche = "";

    @Column(name = "follower_count", nullable = false)
    long followerCount;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    // Creator owns its videos, removing it removes them all
    @OneToMany(mappedBy = "creator", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Video> videos = new ArrayList<>();

    public void addVideo(Video video) {
        video.setCreator(this);
        videos.add(video);
    }
}
