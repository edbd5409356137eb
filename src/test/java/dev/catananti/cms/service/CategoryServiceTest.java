package dev.catananti.cms.service;

import dev.catananti.cms.dto.CategoryRequest;
import dev.catananti.cms.dto.CategoryUpdateRequest;
import dev.catananti.cms.entity.Category;
import dev.catananti.cms.entity.User;
import dev.catananti.cms.exception.AuthorizationException;
import dev.catananti.cms.exception.BusinessRuleException;
import dev.catananti.cms.exception.ErrorManager;
import dev.catananti.cms.exception.ResourceNotFoundException;
import dev.catananti.cms.exception.ValidationException;
import dev.catananti.cms.repository.ArticleRepository;
import dev.catananti.cms.repository.CategoryRepository;
import dev.catananti.cms.security.CurrentUserService;
import dev.catananti.cms.validation.InputValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private CurrentUserService currentUserService;

    private CategoryService categoryService;

    private final User staff = User.builder().id(3L).username("editor").staff(true).build();
    private final User reader = User.builder().id(4L).username("reader").build();

    @BeforeEach
    void setUp() {
        categoryService = new CategoryService(
                categoryRepository,
                new SlugService(articleRepository, categoryRepository),
                currentUserService,
                new InputValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new ErrorManager(CLOCK, new SimpleMeterRegistry()),
                CLOCK);
    }

    private Category science() {
        return Category.builder()
                .id(5L)
                .name("Science")
                .slug("science")
                .description("Papers")
                .createdAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .updatedAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .build();
    }

    @Nested
    @DisplayName("createCategory")
    class CreateCategory {

        @Test
        @DisplayName("should create an active category with a derived slug")
        void shouldCreate() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.existsBySlug("science")).thenReturn(Mono.just(false));
            when(categoryRepository.save(any(Category.class))).thenAnswer(invocation -> {
                Category category = invocation.getArgument(0);
                category.setId(5L);
                return Mono.just(category);
            });

            StepVerifier.create(categoryService.createCategory(
                            CategoryRequest.builder().name(" Science ").description("").build()))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo(5L);
                        assertThat(response.getName()).isEqualTo("Science");
                        assertThat(response.getSlug()).isEqualTo("science");
                        assertThat(response.getDescription()).isNull();
                        assertThat(response.getIsActive()).isTrue();
                    })
                    .verifyComplete();

            verifyNoInteractions(articleRepository);
        }

        @Test
        @DisplayName("should give identically named categories distinct slugs when they race")
        void shouldResolveConcurrentCreation() {
            Set<String> stored = new HashSet<>();
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.existsBySlug(anyString()))
                    .thenAnswer(invocation -> Mono.just(stored.contains(invocation.<String>getArgument(0))));
            // a concurrent request has already checked "science" as free and commits it first
            when(categoryRepository.save(any(Category.class)))
                    .thenAnswer(invocation -> {
                        stored.add("science");
                        return Mono.error(new DataIntegrityViolationException("duplicate key value (slug)=(science)"));
                    })
                    .thenAnswer(invocation -> {
                        Category category = invocation.getArgument(0);
                        stored.add(category.getSlug());
                        return Mono.just(category);
                    });

            StepVerifier.create(categoryService.createCategory(CategoryRequest.builder().name("Science").build()))
                    .assertNext(response -> assertThat(response.getSlug()).isEqualTo("science-1"))
                    .verifyComplete();

            assertThat(stored).containsExactlyInAnyOrder("science", "science-1");
        }

        @Test
        @DisplayName("should refuse non-staff users")
        void shouldRefuseNonStaff() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(reader));

            StepVerifier.create(categoryService.createCategory(CategoryRequest.builder().name("Science").build()))
                    .expectErrorMatches(ex -> ex instanceof AuthorizationException
                            && ex.getMessage().equals("Staff privileges required"))
                    .verify();

            verify(categoryRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject a name made of control characters only")
        void shouldRejectEmptyName() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));

            StepVerifier.create(categoryService.createCategory(CategoryRequest.builder().name("\u0000\u0007").build()))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(ValidationException.class).hasMessage("Category name is required");
                        assertThat(((ValidationException) ex).getDetails())
                                .containsEntry("operation", "category_creation");
                    })
                    .verify();
        }

        @Test
        @DisplayName("should hide storage failures behind the default message")
        void shouldReportStorageFailure() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.existsBySlug("science")).thenReturn(Mono.just(false));
            when(categoryRepository.save(any(Category.class)))
                    .thenReturn(Mono.error(new DataIntegrityViolationException("value too long for column")));

            StepVerifier.create(categoryService.createCategory(CategoryRequest.builder().name("Science").build()))
                    .expectErrorSatisfies(ex -> assertThat(ex)
                            .isInstanceOf(ValidationException.class)
                            .hasMessage("An error occurred while processing your request."))
                    .verify();
        }
    }

    @Nested
    @DisplayName("updateCategory")
    class UpdateCategory {

        @Test
        @DisplayName("should fail when the category does not exist")
        void shouldFailWhenMissing() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.findById(99L)).thenReturn(Mono.empty());

            StepVerifier.create(categoryService.updateCategory(99L, CategoryUpdateRequest.builder().name("X").build()))
                    .expectErrorMatches(ex -> ex instanceof BusinessRuleException
                            && ex.getMessage().equals("Category not found"))
                    .verify();
        }

        @Test
        @DisplayName("should re-derive the slug when renamed")
        void shouldRederiveSlug() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.findById(5L)).thenReturn(Mono.just(science()));
            when(categoryRepository.existsBySlugAndIdNot("physics", 5L)).thenReturn(Mono.just(false));
            when(categoryRepository.save(any(Category.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(categoryService.updateCategory(5L, CategoryUpdateRequest.builder().name("Physics").build()))
                    .assertNext(response -> {
                        assertThat(response.getName()).isEqualTo("Physics");
                        assertThat(response.getSlug()).isEqualTo("physics");
                        assertThat(response.getUpdatedAt()).isEqualTo(LocalDateTime.of(2024, 4, 1, 12, 0));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep the slug when only the description changes")
        void shouldKeepSlug() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(staff));
            when(categoryRepository.findById(5L)).thenReturn(Mono.just(science()));
            when(categoryRepository.save(any(Category.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(categoryService.updateCategory(5L,
                            CategoryUpdateRequest.builder().name("Science").description("Journals").isActive(false).build()))
                    .assertNext(response -> {
                        assertThat(response.getSlug()).isEqualTo("science");
                        assertThat(response.getDescription()).isEqualTo("Journals");
                        assertThat(response.getIsActive()).isFalse();
                    })
                    .verifyComplete();

            verify(categoryRepository, never()).existsBySlugAndIdNot(anyString(), anyLong());
        }

        @Test
        @DisplayName("should refuse non-staff users before loading the category")
        void shouldRefuseNonStaff() {
            when(currentUserService.requireUser()).thenReturn(Mono.just(reader));

            StepVerifier.create(categoryService.updateCategory(5L, CategoryUpdateRequest.builder().name("X").build()))
                    .expectError(AuthorizationException.class)
                    .verify();

            verify(categoryRepository, never()).findById(anyLong());
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("should list only active categories by default")
        void shouldListActive() {
            when(categoryRepository.findActiveOrderByName()).thenReturn(Flux.just(science()));

            StepVerifier.create(categoryService.listCategories(true))
                    .assertNext(list -> assertThat(list).extracting("slug").containsExactly("science"))
                    .verifyComplete();

            verify(categoryRepository, never()).findAllOrderByName();
        }

        @Test
        @DisplayName("should list every category on request")
        void shouldListAll() {
            when(categoryRepository.findAllOrderByName()).thenReturn(Flux.empty());

            StepVerifier.create(categoryService.listCategories(false))
                    .assertNext(list -> assertThat(list).isEmpty())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report an unknown or inactive slug as not found")
        void shouldReportMissing() {
            when(categoryRepository.findActiveBySlug("gone")).thenReturn(Mono.empty());

            StepVerifier.create(categoryService.getCategoryBySlug("gone"))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }
}
