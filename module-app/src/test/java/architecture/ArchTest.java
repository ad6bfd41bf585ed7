package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.stereotype.Service;
import org.springframework.web.bind.annotation.RestController;

/**
 * 멀티 모듈 구조 아키텍처 규칙
 *
 * <pre>
 * module-app      (Spring Boot HTTP, 설정, Executor)
 *     ↓ depends on
 * module-core     (천장 모델, 정확 해, 몬테카를로)
 *     ↓ depends on
 * module-common   (에러 코드, 예외 계층)
 * </pre>
 *
 * <ul>
 *   <li>의존 방향: app → core → common (역방향 금지)
 *   <li>core 는 Spring 에 의존하지 않음
 *   <li>core 의 난수는 시드 고정 가능한 SplittableRandom 만 사용
 * </ul>
 *
 * @see <a href="https://www.archunit.org/">ArchUnit Documentation</a>
 */
@DisplayName("Architectural Rules (Multi-Module Structure)")
public class ArchTest {

  private static final String CORE = "gacha.expectation.core..";

  private static final String[] APP_PACKAGES = {
    "gacha.expectation.application..",
    "gacha.expectation.config..",
    "gacha.expectation.controller..",
    "gacha.expectation.global.."
  };

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("gacha.expectation");

  @Nested
  @DisplayName("Dependency Direction: app → core → common")
  class DependencyDirection {

    @Test
    @DisplayName("core 는 app 패키지에 의존하지 않는다")
    void coreDoesNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(APP_PACKAGES)
          .because("core must stay usable without the HTTP surface")
          .check(classes);
    }

    @Test
    @DisplayName("common(error) 은 core/app 에 의존하지 않는다")
    void commonIsLeaf() {
      noClasses()
          .that()
          .resideInAPackage("gacha.expectation.error..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(CORE, "gacha.expectation.application..", "gacha.expectation.config..")
          .check(classes);
    }

    @Test
    @DisplayName("컨트롤러는 계산 엔진을 직접 호출하지 않는다")
    void controllersGoThroughApplicationService() {
      noClasses()
          .that()
          .resideInAPackage("gacha.expectation.controller..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "gacha.expectation.core.probability..", "gacha.expectation.core.validation..")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Spring-Free Core")
  class SpringFreeCore {

    @Test
    @DisplayName("core 는 Spring 클래스를 참조하지 않는다")
    void coreHasNoSpringDependency() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .check(classes);
    }

    @Test
    @DisplayName("core 는 시드 없는 난수원을 쓰지 않는다")
    void coreUsesSeedableRandomOnly() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .haveFullyQualifiedName("java.util.Random")
          .orShould()
          .dependOnClassesThat()
          .haveFullyQualifiedName("java.util.concurrent.ThreadLocalRandom")
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Layer Placement")
  class LayerPlacement {

    @Test
    @DisplayName("@Service 는 application.service 패키지에 위치")
    void servicesResideInApplicationLayer() {
      classes()
          .that()
          .areAnnotatedWith(Service.class)
          .should()
          .resideInAPackage("gacha.expectation.application.service..")
          .check(classes);
    }

    @Test
    @DisplayName("@RestController 는 controller 패키지에 위치")
    void controllersResideInControllerPackage() {
      classes()
          .that()
          .areAnnotatedWith(RestController.class)
          .should()
          .resideInAPackage("gacha.expectation.controller")
          .check(classes);
    }
  }
}
