package quest.gekko.creators.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.creators.domain.Creator;
import quest.gekko.creators.repository.CreatorRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreatorServiceTest {
    @Mock
    CreatorRepository creatorRepository;

    @InjectMocks
    CreatorService creatorService;

    @Test
    void handleIsTrimmedAndLosesItsAtSign() {
        assertThat(CreatorService.normalizeHandle("  @charli.d_amelio ")).isEqualTo("charli.d_amelio");
    }

    @Test
    void invalidHandlesAreRejected() {
        assertThatThrownBy(() -> CreatorService.normalizeHandle("has space")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreatorService.normalizeHandle("dash-name")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreatorService.normalizeHandle("a".repeat(31))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreatorService.normalizeHandle("@")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CreatorService.normalizeHandle(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trackCreatesCreatorWithTrimmedNiche() {
        when(creatorRepository.existsByHandle("khaby.lame")).thenReturn(false);
        when(creatorRepository.save(any(Creator.class))).thenAnswer(inv -> {
            Creator c = inv.getArgument(0);
            c.setId(7L);
            return c;
        });

        Creator created = creatorService.track("@khaby.lame", "  comedy ");

        assertThat(created.getId()).isEqualTo(7L);
        assertThat(created.getHandle()).isEqualTo("khaby.lame");
        assertThat(created.getNiche()).isEqualTo("comedy");
        assertThat(created.getFollowerCount()).isZero();
    }

    @Test
    void trackingAnExistingHandleConflicts() {
        when(creatorRepository.existsByHandle("khaby.lame")).thenReturn(true);

        assertThatThrownBy(() -> creatorService.track("khaby.lame", ""))
                .isInstanceOf(DuplicateCreatorException.class)
                .hasMessageContaining("already being tracked");
        verify(creatorRepository, never()).save(any());
    }

    @Test
    void updateNicheReplacesLabel() {
        Creator creator = new Creator();
        creator.setId(3L);
        creator.setHandle("chef");
        when(creatorRepository.findById(3L)).thenReturn(Optional.of(creator));
        when(creatorRepository.save(creator)).thenReturn(creator);

        assertThat(creatorService.updateNiche(3L, " food ").getNiche()).isEqualTo("food");
    }

    @Test
    void deletingUnknownCreatorFails() {
        when(creatorRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> creatorService.delete(5L)).isInstanceOf(CreatorNotFoundException.class);
    }

    @Test
    void deleteRemovesCreator() {
        Creator creator = new Creator();
        creator.setHandle("chef");
        when(creatorRepository.findById(3L)).thenReturn(Optional.of(creator));

        creatorService.delete(3L);

        verify(creatorRepository).delete(creator);
    }
}
