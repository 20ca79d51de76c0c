package org.folprover.base.test;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({ClauseStoreTests.class,
                     CnfConverterTests.class,
                     ResolutionEngineTests.class,
                     ResolutionProverTests.class,
                     ScopeCounterTests.class,
                     StaticValidatorTests.class,
                     SubstitutionTests.class,
                     UnifierTests.class})
public class FastTests
{

}
