package dev.trawler.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.trawler", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Building blocks know nothing about the engine that composes them.
  @ArchTest
  static final ArchRule building_blocks_should_not_depend_on_the_engine =
      noClasses()
          .that()
          .resideInAnyPackage("..url..", "..policy..", "..cache..", "..render..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..crawl..", "..mcp..");

  // The URL package is the leaf of the dependency graph.
  @ArchTest
  static final ArchRule url_should_be_a_leaf =
      noClasses()
          .that()
          .resideInAPackage("..url..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..policy..", "..cache..", "..render..", "..crawl..", "..mcp..");

  // Only the MCP adapter talks to the outside world through tools.
  @ArchTest
  static final ArchRule engine_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAPackage("..crawl..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..mcp..");

  // Config package should not depend on feature or adapter packages
  @ArchTest
  static final ArchRule config_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..crawl..", "..mcp..")
          .allowEmptyShould(true);

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.trawler.(*)..").should().beFreeOfCycles();
}
