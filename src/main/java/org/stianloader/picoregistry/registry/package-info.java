/**
 * Package storing the registry abstraction, the GitHub-backed registry implementations and the
 * {@link org.stianloader.picoregistry.registry.CachingRegistryProvider provider} that creates and caches them.
 *
 * <p>Storing registry records is not the task of this package, see
 * {@link org.stianloader.picoregistry.service.RegistryService} for that. Talking to GitHub is delegated to
 * {@link org.stianloader.picoregistry.github.GithubContentLister}.
 */
package org.stianloader.picoregistry.registry;
