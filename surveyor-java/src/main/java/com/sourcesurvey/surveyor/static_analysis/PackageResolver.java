package com.sourcesurvey.surveyor.static_analysis;

import com.sourcesurvey.surveyor.manifest.DiscoveredPackage;

/**
 * Parses and resolves every compilation unit of a package.
 */
public interface PackageResolver {

    /**
     * @throws com.sourcesurvey.surveyor.manifest.PackageManifestReader.ManifestException
     *         if the package manifest is missing or malformed
     * @throws com.sourcesurvey.surveyor.build.DependencyInstaller.DependencyInstallException
     *         if dependencies had to be installed and the install failed
     * @throws ResolveException for any other resolver failure
     */
    ResolvedPackage resolvePackage(DiscoveredPackage pkg);
}
