package io.itemsapi.items.service;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "io.itemsapi", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  @ArchTest
  static final ArchRule domain_is_framework_free =
      noClasses()
          .that()
          .resideInAnyPackage("io.itemsapi.items.domain..", "io.itemsapi.platform.domain..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("org.springframework..", "jakarta.servlet..");

  @ArchTest
  static final ArchRule domain_does_not_see_web =
      noClasses()
          .that()
          .resideInAPackage("io.itemsapi.items.domain..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("io.itemsapi.items.service..", "io.itemsapi.platform.http..");

  @ArchTest
  static final ArchRule controllers_use_store_interface =
      noClasses()
          .that()
          .resideInAPackage("io.itemsapi.items.service.web..")
          .should()
          .dependOnClassesThat()
          .haveSimpleName("InMemoryItemStore");
}
