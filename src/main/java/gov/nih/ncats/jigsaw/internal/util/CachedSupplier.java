package gov.nih.ncats.jigsaw.internal.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Memoized supplier. The delegate is called at most once,
 * on the first {@link #get()}, and its value is kept.
 *
 * @param <T>
 */
public class CachedSupplier<T> implements Supplier<T>{

	private final Supplier<T> c;
	private volatile T cache;
	private volatile boolean run=false;

	public CachedSupplier(final Supplier<T> c){
		this.c=Objects.requireNonNull(c);
	}

	@Override
	public T get() {
		if(run) {
			return this.cache;
		}
		synchronized(this){
			if(run){
				return this.cache;
			}
			this.cache=c.get();
			this.run=true;
			return this.cache;
		}
	}

	public boolean hasRun(){
		return this.run;
	}

	public static <T> CachedSupplier<T> of(final Supplier<T> supplier){
		return new CachedSupplier<T>(supplier);
	}
}
